package com.shardchat.gateway.cluster.health;

import com.shardchat.gateway.client.ShardClientPool;
import com.shardchat.gateway.cluster.model.EndpointProbe;
import com.shardchat.gateway.cluster.model.ShardDescriptor;
import com.shardchat.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * Active health probe of every endpoint of a shard. Does not touch {@link ShardHealthMonitor}.
 */
@Slf4j
@Component
public class ShardProber {

    private final ShardClientPool clientPool;
    private final Duration timeout;

    public ShardProber(ShardClientPool clientPool, GatewayProperties properties) {
        this.clientPool = clientPool;
        this.timeout = properties.getRequestTimeout();
    }

    public Mono<List<EndpointProbe>> probe(ShardDescriptor shard) {
        return Flux.fromIterable(shard.endpoints())
                .flatMapSequential(endpoint -> probe(shard.id(), endpoint))
                .collectList();
    }

    private Mono<EndpointProbe> probe(int shardId, URI endpoint) {
        return Mono.defer(() -> clientPool.get(endpoint).health())
                .timeout(timeout)
                .map(status -> new EndpointProbe(endpoint.toString(), true, status.status()))
                .defaultIfEmpty(new EndpointProbe(endpoint.toString(), true, null))
                .onErrorResume(error -> {
                    log.debug("Probe of shard {} endpoint {} failed: {}", shardId, endpoint, error.toString());
                    return Mono.just(new EndpointProbe(endpoint.toString(), false, error.toString()));
                });
    }
}
