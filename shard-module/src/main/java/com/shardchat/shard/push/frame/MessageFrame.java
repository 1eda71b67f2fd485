package com.shardchat.shard.push.frame;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.shardchat.common.model.ChatMessage;

import java.time.Instant;

/**
 * A message pushed to its recipient.
 */
public record MessageFrame(
    @JsonProperty("id")
    String id,

    @JsonProperty("from_user_id")
    String fromUserId,

    @JsonProperty("to_user_id")
    String toUserId,

    @JsonProperty("content")
    String content,

    @JsonProperty("created_at")
    Instant createdAt
) implements OutboundFrame {

    public static MessageFrame of(ChatMessage message) {
        return new MessageFrame(message.id(), message.fromUserId(), message.toUserId(),
                message.content(), message.createdAt());
    }

    @JsonIgnore
    @Override
    public String type() {
        return "message";
    }
}
