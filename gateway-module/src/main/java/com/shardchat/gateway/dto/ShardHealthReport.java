package com.shardchat.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ShardHealthReport(
    @JsonProperty("shards")
    List<ShardHealthView> shards,

    @JsonProperty("probed")
    boolean probed
) {
}
