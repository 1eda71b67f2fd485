package com.shardchat.shard.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shardchat.common.model.ChatMessage;
import com.shardchat.common.model.SendMessageRequest;
import com.shardchat.common.model.ShardConversationResponse;
import com.shardchat.common.model.ShardUsersResponse;
import com.shardchat.common.model.UserMessagesResponse;
import com.shardchat.common.model.UserRecord;
import com.shardchat.common.routing.ShardAssigner;
import com.shardchat.common.routing.UserIds;
import com.shardchat.common.serialization.ChatJson;
import com.shardchat.shard.cache.CacheKeys;
import com.shardchat.shard.cache.CachedPage;
import com.shardchat.shard.cache.MessageCache;
import com.shardchat.shard.config.ShardProperties;
import com.shardchat.shard.id.MessageIdGenerator;
import com.shardchat.shard.push.PushNotifier;
import com.shardchat.shard.push.frame.MessageFrame;
import com.shardchat.shard.store.MessageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ShardMessageServiceImpl implements ShardMessageService {

    private final MessageStore messageStore;
    private final MessageCache messageCache;
    private final PushNotifier pushNotifier;
    private final MessageIdGenerator messageIdGenerator;
    private final ShardAssigner shardAssigner;
    private final ShardProperties properties;
    private final Clock clock;
    private final ObjectMapper objectMapper = ChatJson.mapper();

    @Override
    public ChatMessage sendMessage(SendMessageRequest request) {
        String fromUserId = UserIds.normalize(request.fromUserId());
        String toUserId = UserIds.normalize(request.toUserId());
        if (request.content() == null || request.content().isBlank()) {
            throw new IllegalArgumentException("Message content must not be empty");
        }

        int ownerShard = shardAssigner.shardOf(fromUserId);
        if (ownerShard != properties.getId()) {
            log.warn("Message from user {} belongs to shard {} but was sent to shard {}",
                    fromUserId, ownerShard, properties.getId());
        }

        ChatMessage message = ChatMessage.builder()
                .id(messageIdGenerator.nextId())
                .fromUserId(fromUserId)
                .toUserId(toUserId)
                .content(request.content())
                .createdAt(Instant.now(clock).truncatedTo(ChronoUnit.MILLIS))
                .shardId(properties.getId())
                .build();

        messageStore.insert(message);
        log.info("Stored message {} from {} to {} on shard {}", message.id(), fromUserId, toUserId, properties.getId());

        evictQuietly(CacheKeys.conversation(fromUserId, toUserId));
        evictQuietly(CacheKeys.conversation(toUserId, fromUserId));
        evictQuietly(CacheKeys.inbox(fromUserId));
        evictQuietly(CacheKeys.inbox(toUserId));

        if (pushNotifier.deliver(toUserId, MessageFrame.of(message))) {
            log.debug("Pushed message {} to user {}", message.id(), toUserId);
        }

        return message;
    }

    @Override
    public UserMessagesResponse messagesFor(String userId, Integer limit) {
        String normalized = UserIds.normalize(userId);
        int effectiveLimit = resolveLimit(limit, properties.getDefaultInboxLimit());

        List<ChatMessage> messages = cached(CacheKeys.inbox(normalized), effectiveLimit,
                () -> messageStore.findByParticipant(normalized, effectiveLimit));

        return new UserMessagesResponse(messages, normalized, properties.getId());
    }

    @Override
    public ShardConversationResponse conversation(String userId, String otherUserId, Integer limit) {
        String normalized = UserIds.normalize(userId);
        String otherNormalized = UserIds.normalize(otherUserId);
        int effectiveLimit = resolveLimit(limit, properties.getDefaultConversationLimit());

        List<ChatMessage> messages = cached(CacheKeys.conversation(normalized, otherNormalized), effectiveLimit,
                () -> messageStore.findConversation(normalized, otherNormalized, effectiveLimit));

        return new ShardConversationResponse(messages, normalized, otherNormalized, properties.getId());
    }

    @Override
    public ShardUsersResponse listUsers() {
        List<UserRecord> users = new ArrayList<>(messageStore.findAllUsers());
        Set<String> known = users.stream().map(UserRecord::id).collect(Collectors.toSet());

        // senders that never got a user record still show up, as they did before user records existed
        for (String senderId : messageStore.findSenderIds()) {
            if (known.add(senderId)) {
                users.add(new UserRecord(senderId, null, shardAssigner.shardOf(senderId)));
            }
        }

        return new ShardUsersResponse(users, properties.getId());
    }

    @Override
    public boolean isHealthy() {
        return messageStore.isHealthy();
    }

    @Override
    public void applyReplicatedMessages(List<ChatMessage> messages) {
        messageStore.upsertMessages(messages);
        // content of an existing message may have changed
        for (ChatMessage message : messages) {
            evictQuietly(CacheKeys.conversation(message.fromUserId(), message.toUserId()));
            evictQuietly(CacheKeys.conversation(message.toUserId(), message.fromUserId()));
            evictQuietly(CacheKeys.inbox(message.fromUserId()));
            evictQuietly(CacheKeys.inbox(message.toUserId()));
        }
        log.debug("Applied {} replicated messages", messages.size());
    }

    @Override
    public void applyReplicatedUsers(List<UserRecord> users) {
        messageStore.upsertUsers(users);
        log.debug("Applied {} replicated users", users.size());
    }

    private List<ChatMessage> cached(String key, int limit, Supplier<List<ChatMessage>> loader) {
        Optional<CachedPage> hit = readCache(key);
        if (hit.isPresent() && hit.get().covers(limit)) {
            log.debug("Cache hit for {}", key);
            return hit.get().firstN(limit);
        }

        log.debug("Cache miss for {}", key);
        List<ChatMessage> messages = loader.get();
        writeCache(key, new CachedPage(limit, messages));
        return messages;
    }

    private Optional<CachedPage> readCache(String key) {
        try {
            Optional<String> value = messageCache.get(key);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(value.get(), CachedPage.class));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable cache entry {}: {}", key, e.getOriginalMessage());
            evictQuietly(key);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Cache read for {} failed, falling back to store: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String key, CachedPage page) {
        try {
            messageCache.put(key, objectMapper.writeValueAsString(page), properties.getCache().getTtl());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Cache write for {} failed: {}", key, e.getMessage());
        }
    }

    private void evictQuietly(String key) {
        try {
            messageCache.evict(key);
        } catch (RuntimeException e) {
            log.warn("Cache invalidation of {} failed: {}", key, e.getMessage());
        }
    }

    private int resolveLimit(Integer requested, int defaultLimit) {
        if (requested == null) {
            return defaultLimit;
        }
        if (requested < 1) {
            throw new IllegalArgumentException("limit must be positive, got " + requested);
        }
        return Math.min(requested, properties.getMaxLimit());
    }
}
