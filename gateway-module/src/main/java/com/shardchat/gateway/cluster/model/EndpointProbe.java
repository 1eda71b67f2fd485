package com.shardchat.gateway.cluster.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of actively probing one shard endpoint.
 */
public record EndpointProbe(
    @JsonProperty("endpoint")
    String endpoint,

    @JsonProperty("reachable")
    boolean reachable,

    @JsonProperty("detail")
    String detail
) {
}
