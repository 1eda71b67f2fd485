package com.shardchat.shard.service;

import com.shardchat.common.model.ChatMessage;
import com.shardchat.common.model.SendMessageRequest;
import com.shardchat.common.model.ShardConversationResponse;
import com.shardchat.common.model.ShardUsersResponse;
import com.shardchat.common.model.UserMessagesResponse;
import com.shardchat.common.model.UserRecord;

import java.util.List;

/** Операции шарда над сообщениями */
public interface ShardMessageService {

    /**
     * Persist a new message, invalidate the affected cache entries and push it to the recipient if connected.
     *
     * @return the stored message with its id, server timestamp and shard id
     * @throws IllegalArgumentException on malformed ids or empty content
     * @throws com.shardchat.shard.store.MessageStoreException if the message could not be persisted
     */
    ChatMessage sendMessage(SendMessageRequest request);

    /** Сообщения пользователя, новые первыми */
    UserMessagesResponse messagesFor(String userId, Integer limit);

    /** Переписка двух пользователей в хронологическом порядке */
    ShardConversationResponse conversation(String userId, String otherUserId, Integer limit);

    /** Пользователи шарда */
    ShardUsersResponse listUsers();

    /** Проверить здоровье хранилища */
    boolean isHealthy();

    /** Принять реплицированные сообщения от primary */
    void applyReplicatedMessages(List<ChatMessage> messages);

    /** Принять реплицированных пользователей от primary */
    void applyReplicatedUsers(List<UserRecord> users);
}
