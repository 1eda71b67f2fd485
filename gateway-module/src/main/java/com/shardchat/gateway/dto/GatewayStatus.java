package com.shardchat.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Gateway liveness together with the cached shard table.
 */
public record GatewayStatus(
    @JsonProperty("status")
    String status,

    @JsonProperty("service")
    String service,

    @JsonProperty("shards")
    List<ShardHealthView> shards
) {
}
