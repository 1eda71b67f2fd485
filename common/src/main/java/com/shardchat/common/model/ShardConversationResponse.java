package com.shardchat.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Conversation between two users as seen by a single shard, oldest first.
 */
public record ShardConversationResponse(
    @JsonProperty("messages")
    List<ChatMessage> messages,

    @JsonProperty("user_id")
    String userId,

    @JsonProperty("other_user_id")
    String otherUserId,

    @JsonProperty("shard_id")
    Integer shardId
) {
    @JsonCreator
    public ShardConversationResponse {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
