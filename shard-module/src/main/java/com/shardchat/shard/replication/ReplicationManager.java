package com.shardchat.shard.replication;

import com.shardchat.common.model.ChatMessage;
import com.shardchat.common.model.UserRecord;
import com.shardchat.shard.config.ShardProperties;
import com.shardchat.shard.store.BackupStore;
import com.shardchat.shard.store.MessageStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background primary -> backup replication of one shard.
 * <p>
 * Every tick copies all users and the messages created after the lower bound, using idempotent upserts, so
 * re-delivery is harmless. The lower bound trails the start of the last successful tick by the replication
 * window: an outage longer than the window does not lose messages. Before the first tick both stores are
 * checked; a failed check is retried after a fixed delay.
 */
@Slf4j
public class ReplicationManager implements SmartLifecycle {

    private final int shardId;
    private final MessageStore primaryStore;
    private final BackupStore backupStore;
    private final ScheduledExecutorService scheduler;
    private final ShardProperties.Replication settings;
    private final Clock clock;

    private final Object lifecycleMonitor = new Object();
    private volatile boolean running;
    private volatile boolean initialized;
    private ScheduledFuture<?> pendingInitialization;
    private ScheduledFuture<?> syncTask;

    /** Start of the last successful tick, null until one succeeded */
    private volatile Instant lastSuccessfulTick;

    public ReplicationManager(int shardId,
                              MessageStore primaryStore,
                              BackupStore backupStore,
                              ScheduledExecutorService scheduler,
                              ShardProperties.Replication settings,
                              Clock clock) {
        this.shardId = shardId;
        this.primaryStore = primaryStore;
        this.backupStore = backupStore;
        this.scheduler = scheduler;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (running) {
                return;
            }
            running = true;
            pendingInitialization = scheduler.schedule(this::initialize, 0, TimeUnit.MILLISECONDS);
        }
        log.info("[replication] shard {}: starting", shardId);
    }

    @Override
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (!running) {
                return;
            }
            running = false;
            cancel(pendingInitialization);
            cancel(syncTask);
            pendingInitialization = null;
            syncTask = null;
        }
        log.info("[replication] shard {}: stopped", shardId);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public boolean isInitialized() {
        return initialized;
    }

    void initialize() {
        if (!running) {
            return;
        }

        try {
            primaryStore.verifyConnectivity();
            log.info("[replication] shard {}: primary store connected", shardId);
            backupStore.verifyConnectivity();
            log.info("[replication] shard {}: backup store connected", shardId);
        } catch (RuntimeException e) {
            Duration retryDelay = settings.getInitRetryDelay();
            log.error("[replication] shard {}: initialization failed, retrying in {}: {}",
                    shardId, retryDelay, e.getMessage());
            synchronized (lifecycleMonitor) {
                if (running) {
                    pendingInitialization = scheduler.schedule(this::initialize, retryDelay.toMillis(), TimeUnit.MILLISECONDS);
                }
            }
            return;
        }

        synchronized (lifecycleMonitor) {
            if (!running) {
                return;
            }
            initialized = true;
            long intervalMillis = settings.getInterval().toMillis();
            syncTask = scheduler.scheduleWithFixedDelay(this::syncQuietly, 0, intervalMillis, TimeUnit.MILLISECONDS);
        }
        log.info("[replication] shard {}: syncing every {}", shardId, settings.getInterval());
    }

    /**
     * Run one replication pass. Exceptions propagate; the scheduled loop absorbs them.
     */
    public ReplicationResult syncOnce() {
        Instant tickStart = clock.instant();
        Instant since = lowerBound(tickStart);

        List<UserRecord> users = primaryStore.findAllUsers();
        backupStore.upsertUsers(users);

        List<ChatMessage> messages = primaryStore.findCreatedSince(since);
        backupStore.upsertMessages(messages);

        lastSuccessfulTick = tickStart;

        if (!users.isEmpty() || !messages.isEmpty()) {
            log.info("[replication] shard {}: synced {} users, {} messages", shardId, users.size(), messages.size());
        } else {
            log.debug("[replication] shard {}: nothing new since {}", shardId, since);
        }
        return new ReplicationResult(users.size(), messages.size(), since);
    }

    /**
     * Anything escaping a scheduleWithFixedDelay task cancels all later runs, errors included.
     */
    private void syncQuietly() {
        try {
            syncOnce();
        } catch (Throwable e) {
            log.error("[replication] shard {}: sync error: {}", shardId, e.getMessage(), e);
        }
    }

    private Instant lowerBound(Instant tickStart) {
        Instant previous = lastSuccessfulTick;
        if (previous == null) {
            return settings.isFullSyncOnStart() ? Instant.EPOCH : tickStart.minus(settings.getWindow());
        }
        return previous.minus(settings.getWindow());
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }
}
