package com.shardchat.shard.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.shardchat.shard.replication.ReplicationManager;
import com.shardchat.shard.store.BackupStore;
import com.shardchat.shard.store.MessageStore;
import com.shardchat.shard.store.RemoteBackupStore;
import com.shardchat.shard.store.RocksDbMessageStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Конфигурация фоновой репликации primary -> backup
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "shard.replication", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReplicationConfig {

    /**
     * Один поток: тики репликации не должны перекрываться
     */
    @Bean(name = "replicationScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService replicationScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
            1,
            new ThreadFactoryBuilder().setNameFormat("replication-%d").setDaemon(true).build()
        );
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    @Bean(name = "backupStore")
    @ConditionalOnProperty(prefix = "shard.replication.backup", name = "mode", havingValue = "remote", matchIfMissing = true)
    public BackupStore remoteBackupStore(WebClient.Builder webClientBuilder, ShardProperties properties) {
        ShardProperties.Backup backup = properties.getReplication().getBackup();
        log.info("Replicating shard {} to remote backup at {}", properties.getId(), backup.getBaseUrl());
        return new RemoteBackupStore(webClientBuilder.clone(), backup.getBaseUrl(), backup.getTimeout());
    }

    @Bean(name = "backupStore", initMethod = "open", destroyMethod = "close")
    @ConditionalOnProperty(prefix = "shard.replication.backup", name = "mode", havingValue = "local")
    public RocksDbMessageStore localBackupStore(ShardProperties properties) {
        String dataPath = properties.getReplication().getBackup().getDataPath();
        log.info("Replicating shard {} to local backup store at {}", properties.getId(), dataPath);
        return new RocksDbMessageStore(Path.of(dataPath), "backup");
    }

    @Bean
    public ReplicationManager replicationManager(MessageStore messageStore,
                                                 @Qualifier("backupStore") BackupStore backupStore,
                                                 @Qualifier("replicationScheduler") ScheduledExecutorService replicationScheduler,
                                                 ShardProperties properties,
                                                 Clock clock) {
        return new ReplicationManager(
            properties.getId(),
            messageStore,
            backupStore,
            replicationScheduler,
            properties.getReplication(),
            clock
        );
    }
}
