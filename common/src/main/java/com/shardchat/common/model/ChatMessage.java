package com.shardchat.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;

/**
 * A chat message as persisted by the owning shard.
 * Messages are immutable: identity fields never change once written.
 */
@Builder(toBuilder = true)
public record ChatMessage(
    @JsonProperty("id")
    String id,

    @JsonProperty("from_user_id")
    String fromUserId,

    @JsonProperty("to_user_id")
    String toUserId,

    @JsonProperty("content")
    String content,

    @JsonProperty("created_at")
    Instant createdAt,

    @JsonProperty("shard_id")
    Integer shardId
) {
    @JsonCreator
    public ChatMessage {
    }

    /**
     * Copy with replaced content, identity fields untouched. Used by replica upserts.
     */
    public ChatMessage withContent(String newContent) {
        return new ChatMessage(id, fromUserId, toUserId, newContent, createdAt, shardId);
    }

    /**
     * Whether the given user is the sender or the recipient.
     */
    public boolean involves(String userId) {
        return userId.equals(fromUserId) || userId.equals(toUserId);
    }

    /**
     * Whether this message belongs to the conversation between the two users, in either direction.
     */
    public boolean isBetween(String userId, String otherUserId) {
        return (userId.equals(fromUserId) && otherUserId.equals(toUserId))
                || (otherUserId.equals(fromUserId) && userId.equals(toUserId));
    }

    @JsonIgnore
    public long createdAtMillis() {
        return createdAt.toEpochMilli();
    }
}
