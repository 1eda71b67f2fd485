package com.shardchat.shard.store;

import com.shardchat.common.model.ChatMessage;
import com.shardchat.common.model.UserRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable storage of a shard's messages and users.
 */
public interface MessageStore extends BackupStore {

    /**
     * Durably insert a new message. Returns only after the write is acknowledged.
     *
     * @throws MessageStoreException if the write fails or the id is taken
     */
    void insert(ChatMessage message);

    Optional<ChatMessage> findById(String id);

    /**
     * Messages sent or received by the user, newest first.
     */
    List<ChatMessage> findByParticipant(String userId, int limit);

    /**
     * Messages exchanged between the two users in either direction, oldest first.
     */
    List<ChatMessage> findConversation(String userId, String otherUserId, int limit);

    /**
     * Messages with a creation time strictly after {@code since}, oldest first.
     */
    List<ChatMessage> findCreatedSince(Instant since);

    List<UserRecord> findAllUsers();

    Optional<UserRecord> findUser(String id);

    /**
     * Distinct sender ids over all stored messages.
     */
    Set<String> findSenderIds();

    boolean isHealthy();
}
