package com.shardchat.shard.replication;

import com.shardchat.common.model.ChatMessage;
import com.shardchat.common.model.UserRecord;
import com.shardchat.shard.config.ShardProperties;
import com.shardchat.shard.store.BackupStore;
import com.shardchat.shard.store.MessageStore;
import com.shardchat.shard.store.MessageStoreException;
import com.shardchat.shard.store.RocksDbMessageStore;
import com.shardchat.shard.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ReplicationManagerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(T0);
    private final ShardProperties.Replication settings = new ShardProperties.Replication();

    private RocksDbMessageStore primary;
    private RocksDbMessageStore backup;

    @BeforeEach
    void setUp() {
        primary = new RocksDbMessageStore(tempDir.resolve("primary"), "primary");
        primary.open();
        backup = new RocksDbMessageStore(tempDir.resolve("backup"), "backup");
        backup.open();
    }

    @AfterEach
    void tearDown() {
        primary.close();
        backup.close();
    }

    @Test
    @DisplayName("Backup ends up with identical identity fields after a sync")
    void syncCopiesUsersAndMessages() {
        ChatMessage message = new ChatMessage("m1", "1", "2", "hi", T0.minusSeconds(5), 1);
        primary.insert(message);
        primary.upsertUsers(List.of(new UserRecord("1", "Alice", 1)));

        ReplicationResult result = manager(primary, backup, mock(ScheduledExecutorService.class)).syncOnce();

        assertThat(result.users()).isEqualTo(1);
        assertThat(result.messages()).isEqualTo(1);
        assertThat(backup.findById("m1")).contains(message);
        assertThat(backup.findAllUsers()).containsExactly(new UserRecord("1", "Alice", 1));
    }

    @Test
    void firstSyncIsFullWhenConfigured() {
        primary.insert(new ChatMessage("ancient", "1", "2", "old", T0.minus(Duration.ofDays(30)), 1));

        assertThat(manager(primary, backup, mock(ScheduledExecutorService.class)).syncOnce().since()).isEqualTo(Instant.EPOCH);
        assertThat(backup.findById("ancient")).isPresent();
    }

    @Test
    void firstSyncUsesTheWindowWhenFullSyncIsOff() {
        settings.setFullSyncOnStart(false);
        primary.insert(new ChatMessage("ancient", "1", "2", "old", T0.minus(Duration.ofDays(30)), 1));
        primary.insert(new ChatMessage("recent", "1", "2", "new", T0.minusSeconds(30), 1));

        ReplicationResult result = manager(primary, backup, mock(ScheduledExecutorService.class)).syncOnce();

        assertThat(result.since()).isEqualTo(T0.minus(Duration.ofMinutes(1)));
        assertThat(backup.findById("ancient")).isEmpty();
        assertThat(backup.findById("recent")).isPresent();
    }

    @Test
    @DisplayName("Messages written during a backup outage longer than the window are still copied")
    void outageLongerThanWindowLosesNothing() {
        settings.setFullSyncOnStart(false);
        ToggleBackupStore toggleBackup = new ToggleBackupStore(backup);
        ReplicationManager manager = manager(primary, toggleBackup, mock(ScheduledExecutorService.class));
        manager.syncOnce();

        clock.advance(Duration.ofSeconds(5));
        primary.insert(new ChatMessage("during-outage", "1", "2", "hi", clock.instant(), 1));

        toggleBackup.down = true;
        clock.advance(Duration.ofMinutes(10));
        assertThatThrownBy(manager::syncOnce).isInstanceOf(MessageStoreException.class);

        toggleBackup.down = false;
        clock.advance(Duration.ofSeconds(5));
        ReplicationResult result = manager.syncOnce();

        assertThat(result.since()).isEqualTo(T0.minus(Duration.ofMinutes(1)));
        assertThat(backup.findById("during-outage")).isPresent();
    }

    @Test
    void replayedMessageOnlyUpdatesContent() {
        primary.insert(new ChatMessage("m1", "1", "2", "v1", T0, 1));
        backup.insert(new ChatMessage("m1", "1", "2", "v0", T0, 1));

        manager(primary, backup, mock(ScheduledExecutorService.class)).syncOnce();

        ChatMessage copy = backup.findById("m1").orElseThrow();
        assertThat(copy.content()).isEqualTo("v1");
        assertThat(copy.createdAt()).isEqualTo(T0);
    }

    @Test
    void failedInitializationIsRetriedAfterTheConfiguredDelay() {
        MessageStore primaryStore = mock(MessageStore.class);
        BackupStore unreachable = mock(BackupStore.class);
        doThrow(new MessageStoreException("connection refused")).when(unreachable).verifyConnectivity();
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        ReplicationManager manager = manager(primaryStore, unreachable, scheduler);

        manager.start();
        verify(scheduler).schedule(any(Runnable.class), eq(0L), eq(TimeUnit.MILLISECONDS));

        manager.initialize();

        verify(scheduler).schedule(any(Runnable.class), eq(5_000L), eq(TimeUnit.MILLISECONDS));
        verify(scheduler, never()).scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any());
        assertThat(manager.isInitialized()).isFalse();
    }

    @Test
    void successfulInitializationStartsTheLoop() {
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        ReplicationManager manager = manager(primary, backup, scheduler);

        manager.start();
        manager.initialize();

        ArgumentCaptor<Runnable> tick = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleWithFixedDelay(tick.capture(), eq(0L), eq(5_000L), eq(TimeUnit.MILLISECONDS));
        assertThat(manager.isInitialized()).isTrue();

        manager.stop();
        assertThat(manager.isRunning()).isFalse();
    }

    @Test
    void tickErrorsAreAbsorbedAndTheLoopKeepsRunning() throws Exception {
        MessageStore brokenPrimary = mock(MessageStore.class);
        doThrow(new MessageStoreException("io error")).when(brokenPrimary).findAllUsers();
        settings.setInterval(Duration.ofMillis(20));
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            ReplicationManager manager = manager(brokenPrimary, backup, scheduler);
            manager.start();

            // several failing ticks in a row, none of them cancels the schedule
            Thread.sleep(200);
            assertThat(manager.isInitialized()).isTrue();
            assertThat(manager.isRunning()).isTrue();
            verify(brokenPrimary, atLeast(3)).findAllUsers();
            manager.stop();
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void errorsThrownByATickDoNotCancelTheLoop() throws Exception {
        MessageStore brokenPrimary = mock(MessageStore.class);
        doThrow(new LinkageError("users codec missing")).when(brokenPrimary).findAllUsers();
        settings.setInterval(Duration.ofMillis(20));
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            ReplicationManager manager = manager(brokenPrimary, backup, scheduler);
            manager.start();

            Thread.sleep(200);
            verify(brokenPrimary, atLeast(3)).findAllUsers();
            manager.stop();
        } finally {
            scheduler.shutdownNow();
        }
    }

    private ReplicationManager manager(MessageStore primaryStore, BackupStore backupStore, ScheduledExecutorService scheduler) {
        return new ReplicationManager(1, primaryStore, backupStore, scheduler, settings, clock);
    }

    private static class ToggleBackupStore implements BackupStore {
        private final BackupStore delegate;
        private volatile boolean down;

        ToggleBackupStore(BackupStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public void verifyConnectivity() {
            check();
            delegate.verifyConnectivity();
        }

        @Override
        public void upsertUsers(List<UserRecord> users) {
            check();
            delegate.upsertUsers(users);
        }

        @Override
        public void upsertMessages(List<ChatMessage> messages) {
            check();
            delegate.upsertMessages(messages);
        }

        private void check() {
            if (down) {
                throw new MessageStoreException("backup down");
            }
        }
    }
}
