package com.shardchat.shard.store;

import com.shardchat.common.model.ChatMessage;
import com.shardchat.common.model.UserRecord;

import java.util.List;

/**
 * Write side of a store that receives replicated data.
 */
public interface BackupStore {

    /**
     * Check that the store is reachable.
     *
     * @throws MessageStoreException when it is not
     */
    void verifyConnectivity();

    /**
     * Insert or overwrite users by id. Name and shard id of an existing record are replaced.
     */
    void upsertUsers(List<UserRecord> users);

    /**
     * Insert messages by id. For a message that already exists only the content is overwritten,
     * sender, recipient, timestamp and shard id stay as first stored.
     */
    void upsertMessages(List<ChatMessage> messages);
}
