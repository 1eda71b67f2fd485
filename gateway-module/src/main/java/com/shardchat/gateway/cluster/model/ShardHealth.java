package com.shardchat.gateway.cluster.model;

import java.time.Instant;

/**
 * Состояние шарда, как его видит gateway по результатам запросов.
 *
 * @param lastChecked время последнего результата запроса, null до первого запроса
 */
public record ShardHealth(boolean healthy, int consecutiveFailures, Instant lastChecked) {

    public static ShardHealth initial() {
        return new ShardHealth(true, 0, null);
    }

    public static ShardHealth healthy(Instant at) {
        return new ShardHealth(true, 0, at);
    }

    public ShardHealth failed(Instant at) {
        return new ShardHealth(false, consecutiveFailures + 1, at);
    }
}
