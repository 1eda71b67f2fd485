package com.shardchat.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shardchat.common.model.ChatMessage;

import java.util.List;

/**
 * Conversation merged across the shards of both participants.
 */
public record ConversationResponse(
    @JsonProperty("messages")
    List<ChatMessage> messages,

    @JsonProperty("user_id")
    String userId,

    @JsonProperty("other_user_id")
    String otherUserId,

    @JsonProperty("shards_queried")
    List<Integer> shardsQueried
) {
}
