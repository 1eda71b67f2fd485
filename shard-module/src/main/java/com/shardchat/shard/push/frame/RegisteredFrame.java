package com.shardchat.shard.push.frame;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record RegisteredFrame(
    @JsonProperty("user_id")
    String userId,

    @JsonProperty("shard_id")
    int shardId
) implements OutboundFrame {

    @JsonIgnore
    @Override
    public String type() {
        return "registered";
    }
}
