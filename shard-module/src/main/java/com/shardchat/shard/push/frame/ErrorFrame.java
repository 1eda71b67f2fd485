package com.shardchat.shard.push.frame;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorFrame(
    @JsonProperty("message")
    String message
) implements OutboundFrame {

    @JsonIgnore
    @Override
    public String type() {
        return "error";
    }
}
