package com.shardchat.shard.id;

/**
 * Provides fresh message identifiers.
 */
public interface MessageIdGenerator {

    /**
     * Generate a new unique message identifier.
     */
    String nextId();
}
