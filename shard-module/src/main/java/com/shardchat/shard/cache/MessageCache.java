package com.shardchat.shard.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value cache in front of the message store. Values are serialized JSON.
 * Implementations may throw on infrastructure failures; callers treat the cache as best effort.
 */
public interface MessageCache {

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);

    void evict(String key);
}
