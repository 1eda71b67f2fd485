package com.shardchat.shard.cache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.shardchat.common.model.ChatMessage;

import java.util.List;

/**
 * A cached query result together with the limit it was computed for.
 * A page fetched with limit L answers any request with a limit up to L.
 */
public record CachedPage(
    @JsonProperty("limit")
    int limit,

    @JsonProperty("messages")
    List<ChatMessage> messages
) {
    @JsonCreator
    public CachedPage {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public boolean covers(int requestedLimit) {
        return requestedLimit <= limit || messages.size() < limit;
    }

    public List<ChatMessage> firstN(int n) {
        return messages.size() <= n ? messages : messages.subList(0, n);
    }
}
