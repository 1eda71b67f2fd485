package com.shardchat.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ShardUsersResponse(
    @JsonProperty("users")
    List<UserRecord> users,

    @JsonProperty("shard_id")
    Integer shardId
) {
    @JsonCreator
    public ShardUsersResponse {
        users = users == null ? List.of() : List.copyOf(users);
    }
}
