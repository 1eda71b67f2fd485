package com.shardchat.shard.push.frame;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Acknowledgement to the sender that the message was stored.
 */
public record MessageSentFrame(
    @JsonProperty("id")
    String id,

    @JsonProperty("status")
    String status
) implements OutboundFrame {
    public static final String DELIVERED = "delivered";

    public static MessageSentFrame delivered(String messageId) {
        return new MessageSentFrame(messageId, DELIVERED);
    }

    @JsonIgnore
    @Override
    public String type() {
        return "message_sent";
    }
}
