package com.shardchat.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shardchat.common.model.UserRecord;

import java.util.List;

public record UserListResponse(
    @JsonProperty("users")
    List<UserRecord> users,

    @JsonProperty("total")
    int total
) {
    public static UserListResponse of(List<UserRecord> users) {
        return new UserListResponse(users, users.size());
    }
}
