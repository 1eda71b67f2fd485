package com.shardchat.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record UserRecord(
    @NotBlank
    @JsonProperty("id")
    String id,

    @JsonProperty("name")
    String name,

    @JsonProperty("shard_id")
    Integer shardId
) {
    @JsonCreator
    public UserRecord {
    }
}
