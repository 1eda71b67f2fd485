package com.shardchat.shard.cache;

/**
 * Cache key layout shared by every shard node, so that a node and its backup agree on keys.
 */
public final class CacheKeys {
    private static final String INBOX_PREFIX = "user:messages:";
    private static final String CONVERSATION_PREFIX = "conv:";

    private CacheKeys() {
    }

    public static String inbox(String userId) {
        return INBOX_PREFIX + userId;
    }

    /**
     * Directional: the key of (a, b) differs from the key of (b, a).
     */
    public static String conversation(String userId, String otherUserId) {
        return CONVERSATION_PREFIX + userId + ":" + otherUserId;
    }
}
