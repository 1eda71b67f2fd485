package com.shardchat.shard.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of a single shard node process.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "shard")
public class ShardProperties {

    /**
     * Identifier of the shard this node serves, 1..count. A backup node uses the same id as its primary.
     */
    @Min(1)
    private int id = 1;

    /**
     * Total number of shards in the deployment.
     */
    @Min(1)
    private int count = 3;

    @Min(1)
    private int defaultInboxLimit = 50;

    @Min(1)
    private int defaultConversationLimit = 100;

    @Min(1)
    private int maxLimit = 1000;

    @Valid
    @NotNull
    private Storage storage = new Storage();

    @Valid
    @NotNull
    private Cache cache = new Cache();

    @Valid
    @NotNull
    private Replication replication = new Replication();

    @AssertTrue(message = "shard.id must not exceed shard.count")
    public boolean isIdWithinCount() {
        return id <= count;
    }

    public String serviceName() {
        return "shard-" + id;
    }

    @Data
    public static class Storage {
        /**
         * RocksDB directory of this node's primary store.
         */
        @NotBlank
        private String dataPath = "./data/primary";

        /**
         * User records inserted on start when absent.
         */
        private List<SeedUser> seedUsers = new ArrayList<>();
    }

    @Data
    public static class SeedUser {
        private String id;
        private String name;
    }

    @Data
    public static class Cache {
        @NotNull
        private CacheType type = CacheType.LOCAL;

        @NotNull
        private Duration ttl = Duration.ofMinutes(5);

        @Min(1)
        private long maximumSize = 10_000;
    }

    public enum CacheType {
        LOCAL,
        REDIS
    }

    @Data
    public static class Replication {
        private boolean enabled = true;

        @NotNull
        private Duration interval = Duration.ofSeconds(5);

        /**
         * How far back each tick looks for new messages. Deliberately wider than the interval.
         */
        @NotNull
        private Duration window = Duration.ofMinutes(1);

        @NotNull
        private Duration initRetryDelay = Duration.ofSeconds(5);

        /**
         * Copy every message on the first tick after start instead of only the last window.
         */
        private boolean fullSyncOnStart = true;

        @Valid
        @NotNull
        private Backup backup = new Backup();
    }

    @Data
    public static class Backup {
        @NotNull
        private BackupMode mode = BackupMode.REMOTE;

        /**
         * Base URL of the backup shard node, used in REMOTE mode.
         */
        private String baseUrl = "http://localhost:4101";

        /**
         * RocksDB directory of the backup store, used in LOCAL mode.
         */
        private String dataPath = "./data/backup";

        @NotNull
        private Duration timeout = Duration.ofSeconds(5);
    }

    public enum BackupMode {
        REMOTE,
        LOCAL
    }
}
