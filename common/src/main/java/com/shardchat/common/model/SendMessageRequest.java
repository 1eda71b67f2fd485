package com.shardchat.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Body of a send-message call, both at the gateway and at a shard node.
 */
public record SendMessageRequest(
    @NotBlank
    @JsonProperty("from_user_id")
    String fromUserId,

    @NotBlank
    @JsonProperty("to_user_id")
    String toUserId,

    @NotBlank
    @JsonProperty("content")
    String content
) {
    @JsonCreator
    public SendMessageRequest {
    }
}
