package com.shardchat.shard.cache;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * In-process cache for single node deployments and tests. Entries carry their own expiry.
 */
public class LocalMessageCache implements MessageCache {

    private final Cache<String, Entry> cache;
    private final Clock clock;

    public LocalMessageCache(long maximumSize, Duration maximumTtl, Clock clock) {
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(maximumTtl)
                .build();
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            cache.invalidate(key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        cache.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public void evict(String key) {
        cache.invalidate(key);
    }

    public long size() {
        cache.cleanUp();
        return cache.size();
    }

    private record Entry(String value, Instant expiresAt) {
    }
}
