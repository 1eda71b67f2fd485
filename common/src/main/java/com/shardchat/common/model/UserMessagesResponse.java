package com.shardchat.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbox view of a user, most recent first.
 */
public record UserMessagesResponse(
    @JsonProperty("messages")
    List<ChatMessage> messages,

    @JsonProperty("user_id")
    String userId,

    @JsonProperty("shard_id")
    Integer shardId
) {
    @JsonCreator
    public UserMessagesResponse {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
