package com.shardchat.gateway.cluster.health;

import com.shardchat.gateway.cluster.ShardTable;
import com.shardchat.gateway.cluster.model.ShardDescriptor;
import com.shardchat.gateway.cluster.model.ShardHealth;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Здоровье шардов по результатам запросов gateway.
 * <p>
 * Состояние меняют только запросы: успешный ответ любого endpoint шарда помечает его здоровым,
 * отказ всех endpoint помечает нездоровым и увеличивает счетчик ошибок.
 */
@Slf4j
@Service
public class ShardHealthMonitor {

    private final Map<Integer, ShardHealth> shardHealth = new ConcurrentHashMap<>();
    private final Clock clock;

    public ShardHealthMonitor(ShardTable shardTable, Clock clock) {
        this.clock = clock;
        for (ShardDescriptor shard : shardTable.shards()) {
            shardHealth.put(shard.id(), ShardHealth.initial());
        }
    }

    public ShardHealth recordSuccess(int shardId) {
        ShardHealth previous = shardHealth.put(shardId, ShardHealth.healthy(clock.instant()));
        if (previous != null && !previous.healthy()) {
            log.info("Shard {} is healthy again after {} failed requests", shardId, previous.consecutiveFailures());
        }
        return health(shardId);
    }

    public ShardHealth recordFailure(int shardId) {
        ShardHealth updated = shardHealth.compute(shardId, (id, current) ->
                (current == null ? ShardHealth.initial() : current).failed(clock.instant()));
        log.warn("Shard {} marked unhealthy, consecutive failures: {}", shardId, updated.consecutiveFailures());
        return updated;
    }

    public ShardHealth health(int shardId) {
        return shardHealth.getOrDefault(shardId, ShardHealth.initial());
    }

    /**
     * Copy of the current state ordered by shard id.
     */
    public Map<Integer, ShardHealth> snapshot() {
        return new TreeMap<>(shardHealth);
    }
}
