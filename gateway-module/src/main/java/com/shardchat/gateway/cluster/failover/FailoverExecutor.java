package com.shardchat.gateway.cluster.failover;

import com.shardchat.gateway.client.ShardClient;
import com.shardchat.gateway.client.ShardClientPool;
import com.shardchat.gateway.cluster.health.ShardHealthMonitor;
import com.shardchat.gateway.cluster.model.ShardDescriptor;
import com.shardchat.gateway.config.GatewayProperties;
import com.shardchat.gateway.exception.ShardUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.function.Function;

/**
 * Runs a call against a shard, trying its endpoints in order.
 * <p>
 * Each attempt has its own timeout. Connection errors, timeouts and 5xx responses move on to the next endpoint;
 * a 4xx response is the shard's answer and is returned as is. The shard is marked healthy when any attempt
 * succeeds and unhealthy when all of them fail.
 */
@Slf4j
@Component
public class FailoverExecutor {

    private final ShardClientPool clientPool;
    private final ShardHealthMonitor healthMonitor;
    private final Duration requestTimeout;

    public FailoverExecutor(ShardClientPool clientPool, ShardHealthMonitor healthMonitor, GatewayProperties properties) {
        this.clientPool = clientPool;
        this.healthMonitor = healthMonitor;
        this.requestTimeout = properties.getRequestTimeout();
    }

    /**
     * @param operation short description used in logs and errors
     * @return the first successful result; errors with {@link ShardUnavailableException} if every endpoint failed
     */
    public <T> Mono<T> execute(ShardDescriptor shard, String operation, Function<ShardClient, Mono<T>> call) {
        return attempt(shard, operation, call, 0, null);
    }

    private <T> Mono<T> attempt(ShardDescriptor shard, String operation, Function<ShardClient, Mono<T>> call,
                                int index, Throwable lastError) {
        if (index >= shard.endpoints().size()) {
            return Mono.defer(() -> {
                healthMonitor.recordFailure(shard.id());
                log.error("Shard {}: {} failed on all {} endpoints", shard.id(), operation, shard.endpoints().size());
                return Mono.error(new ShardUnavailableException(shard.id(), operation, lastError));
            });
        }

        URI endpoint = shard.endpoints().get(index);
        return Mono.defer(() -> call.apply(clientPool.get(endpoint)))
                .timeout(requestTimeout)
                .doOnSuccess(result -> {
                    healthMonitor.recordSuccess(shard.id());
                    log.debug("Shard {}: {} succeeded via {}", shard.id(), operation, endpoint);
                })
                .onErrorResume(FailoverExecutor::isTransportFailure, error -> {
                    log.warn("Shard {}: {} via {} failed: {}", shard.id(), operation, endpoint, error.toString());
                    return attempt(shard, operation, call, index + 1, error);
                });
    }

    static boolean isTransportFailure(Throwable error) {
        if (error instanceof WebClientResponseException responseException) {
            return responseException.getStatusCode().is5xxServerError();
        }
        return true;
    }
}
