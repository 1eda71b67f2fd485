package com.shardchat.shard.service;

import com.shardchat.common.model.ChatMessage;
import com.shardchat.common.model.SendMessageRequest;
import com.shardchat.common.model.UserRecord;
import com.shardchat.common.routing.ShardAssigner;
import com.shardchat.shard.cache.CacheKeys;
import com.shardchat.shard.cache.LocalMessageCache;
import com.shardchat.shard.cache.MessageCache;
import com.shardchat.shard.config.ShardProperties;
import com.shardchat.shard.push.ConnectionRegistry;
import com.shardchat.shard.push.PushNotifier;
import com.shardchat.shard.push.RecordingPushChannel;
import com.shardchat.shard.push.frame.FrameCodec;
import com.shardchat.shard.store.MessageStore;
import com.shardchat.shard.store.MessageStoreException;
import com.shardchat.shard.store.RocksDbMessageStore;
import com.shardchat.shard.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ShardMessageServiceImplTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00.123456Z"));
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final PushNotifier pushNotifier = new PushNotifier(registry, new FrameCodec());
    private final ShardAssigner shardAssigner = new ShardAssigner(3);
    private final AtomicInteger ids = new AtomicInteger();

    private RocksDbMessageStore store;
    private LocalMessageCache cache;
    private ShardProperties properties;
    private ShardMessageServiceImpl service;

    @BeforeEach
    void setUp() {
        store = new RocksDbMessageStore(tempDir.resolve("primary"), "test");
        store.open();
        cache = new LocalMessageCache(1000, Duration.ofMinutes(5), clock);
        properties = new ShardProperties();
        properties.setId(1);
        properties.setCount(3);
        service = newService(store, cache);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("Returned message carries the sender's shard and a server timestamp")
    void sendMessageAssignsIdTimestampAndShard() {
        ChatMessage message = service.sendMessage(new SendMessageRequest("1", "2", "hi"));

        assertThat(message.id()).isEqualTo("msg-1");
        assertThat(message.shardId()).isEqualTo(shardAssigner.shardOf(message.fromUserId()));
        assertThat(message.createdAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00.123Z"));
        assertThat(store.findById("msg-1")).contains(message);
    }

    @Test
    @DisplayName("A cached empty conversation does not hide a message sent afterwards")
    void sendInvalidatesCachedConversation() {
        assertThat(service.conversation("1", "2", null).messages()).isEmpty();
        assertThat(service.conversation("2", "1", null).messages()).isEmpty();
        assertThat(cache.get(CacheKeys.conversation("1", "2"))).isPresent();

        service.sendMessage(new SendMessageRequest("1", "2", "hi"));

        assertThat(service.conversation("1", "2", null).messages()).extracting(ChatMessage::content).containsExactly("hi");
        assertThat(service.conversation("2", "1", null).messages()).extracting(ChatMessage::content).containsExactly("hi");
    }

    @Test
    void inboxIsNewestFirstAndInvalidatedForBothParticipants() {
        service.sendMessage(new SendMessageRequest("1", "2", "first"));
        assertThat(service.messagesFor("2", null).messages()).hasSize(1);

        clock.advance(Duration.ofSeconds(1));
        service.sendMessage(new SendMessageRequest("1", "2", "second"));

        assertThat(service.messagesFor("2", null).messages())
                .extracting(ChatMessage::content)
                .containsExactly("second", "first");
    }

    @Test
    void cachedPageServesSmallerLimitsAndReloadsForLargerOnes() {
        for (int i = 0; i < 5; i++) {
            service.sendMessage(new SendMessageRequest("1", "2", "m" + i));
            clock.advance(Duration.ofMillis(10));
        }

        assertThat(service.conversation("1", "2", 2).messages()).extracting(ChatMessage::content).containsExactly("m0", "m1");
        assertThat(service.conversation("1", "2", 1).messages()).extracting(ChatMessage::content).containsExactly("m0");
        assertThat(service.conversation("1", "2", 5).messages()).hasSize(5);
    }

    @Test
    void cachedReadDoesNotTouchTheStore() {
        MessageStore mockStore = mock(MessageStore.class);
        when(mockStore.findConversation("1", "2", 100)).thenReturn(List.of());
        ShardMessageServiceImpl cachedService = newService(mockStore, cache);

        cachedService.conversation("1", "2", null);
        cachedService.conversation("1", "2", null);

        verify(mockStore).findConversation("1", "2", 100);
    }

    @Test
    void recipientIsPushedAndPushFailureDoesNotFailTheWrite() {
        RecordingPushChannel recipient = new RecordingPushChannel("s2");
        registry.register("2", recipient);

        service.sendMessage(new SendMessageRequest("1", "2", "hi"));
        assertThat(recipient.sent()).hasSize(1);
        assertThat(recipient.sent().get(0)).contains("\"type\":\"message\"", "\"content\":\"hi\"");

        recipient.failOnSend();
        ChatMessage second = service.sendMessage(new SendMessageRequest("1", "2", "again"));
        assertThat(store.findById(second.id())).isPresent();
    }

    @Test
    void storeFailureIsFatalAndSkipsInvalidationAndPush() {
        MessageStore failingStore = mock(MessageStore.class);
        MessageCache mockCache = mock(MessageCache.class);
        doThrow(new MessageStoreException("disk full")).when(failingStore).insert(any());
        RecordingPushChannel recipient = new RecordingPushChannel("s2");
        registry.register("2", recipient);

        ShardMessageServiceImpl failingService = newService(failingStore, mockCache);

        assertThatThrownBy(() -> failingService.sendMessage(new SendMessageRequest("1", "2", "hi")))
                .isInstanceOf(MessageStoreException.class);
        verify(mockCache, never()).evict(anyString());
        assertThat(recipient.sent()).isEmpty();
    }

    @Test
    void cacheFailuresDegradeToStoreOnly() {
        MessageCache brokenCache = mock(MessageCache.class);
        when(brokenCache.get(anyString())).thenThrow(new IllegalStateException("redis down"));
        doThrow(new IllegalStateException("redis down")).when(brokenCache).evict(anyString());
        doThrow(new IllegalStateException("redis down")).when(brokenCache).put(anyString(), anyString(), any());
        ShardMessageServiceImpl degraded = newService(store, brokenCache);

        degraded.sendMessage(new SendMessageRequest("1", "2", "hi"));

        assertThat(degraded.conversation("1", "2", null).messages()).hasSize(1);
    }

    @Test
    void invalidInputIsRejectedWithoutSideEffects() {
        assertThatThrownBy(() -> service.sendMessage(new SendMessageRequest("abc", "2", "hi")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.sendMessage(new SendMessageRequest("1", "2", "  ")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.messagesFor("1", 0))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(store.findCreatedSince(Instant.EPOCH)).isEmpty();
    }

    @Test
    void listUsersIncludesSendersWithoutRecords() {
        store.upsertUsers(List.of(new UserRecord("1", "Alice", 1)));
        service.sendMessage(new SendMessageRequest("4", "1", "hi"));
        service.sendMessage(new SendMessageRequest("1", "4", "hey"));

        assertThat(service.listUsers().users()).containsExactlyInAnyOrder(
                new UserRecord("1", "Alice", 1),
                new UserRecord("4", null, 1));
    }

    private ShardMessageServiceImpl newService(MessageStore messageStore, MessageCache messageCache) {
        return new ShardMessageServiceImpl(messageStore, messageCache, pushNotifier,
                () -> "msg-" + ids.incrementAndGet(), shardAssigner, properties, clock);
    }
}
