package com.shardchat.shard.cache;

import com.shardchat.shard.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class LocalMessageCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final LocalMessageCache cache = new LocalMessageCache(100, Duration.ofHours(1), clock);

    @Test
    void entryExpiresAfterItsTtl() {
        cache.put("k", "v", Duration.ofSeconds(300));

        clock.advance(Duration.ofSeconds(299));
        assertThat(cache.get("k")).contains("v");

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("k")).isEmpty();
    }

    @Test
    void evictRemovesEntryAndToleratesMissingKeys() {
        cache.put("k", "v", Duration.ofSeconds(300));

        cache.evict("k");
        cache.evict("never-set");

        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void keysAreDirectional() {
        assertThat(CacheKeys.conversation("1", "2")).isEqualTo("conv:1:2");
        assertThat(CacheKeys.conversation("2", "1")).isEqualTo("conv:2:1");
        assertThat(CacheKeys.inbox("1")).isEqualTo("user:messages:1");
    }
}
