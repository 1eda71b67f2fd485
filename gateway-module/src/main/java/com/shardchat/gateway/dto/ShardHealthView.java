package com.shardchat.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.shardchat.gateway.cluster.model.EndpointProbe;
import com.shardchat.gateway.cluster.model.ShardDescriptor;
import com.shardchat.gateway.cluster.model.ShardHealth;

import java.net.URI;
import java.time.Instant;
import java.util.List;

/**
 * A shard as reported by the gateway: endpoints, request-path health and, when asked for, fresh probe results.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ShardHealthView(
    @JsonProperty("id")
    int id,

    @JsonProperty("endpoints")
    List<String> endpoints,

    @JsonProperty("health")
    String health,

    @JsonProperty("consecutive_failures")
    int consecutiveFailures,

    @JsonProperty("last_checked")
    Instant lastChecked,

    @JsonProperty("probes")
    List<EndpointProbe> probes
) {
    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    public static ShardHealthView of(ShardDescriptor shard, ShardHealth health, List<EndpointProbe> probes) {
        return new ShardHealthView(
            shard.id(),
            shard.endpoints().stream().map(URI::toString).toList(),
            health.healthy() ? HEALTHY : UNHEALTHY,
            health.consecutiveFailures(),
            health.lastChecked(),
            probes
        );
    }
}
