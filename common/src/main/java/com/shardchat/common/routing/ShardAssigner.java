package com.shardchat.common.routing;

/**
 * Deterministic user to shard assignment over a static set of shards numbered 1..N.
 * <p>
 * The gateway and the shard nodes must compute exactly the same value, so this is the only place the
 * formula lives: {@code abs(userId) mod N}, with a remainder of 0 mapped to shard N.
 */
public final class ShardAssigner {

    private final int shardCount;

    public ShardAssigner(int shardCount) {
        if (shardCount < 1) {
            throw new IllegalArgumentException("shardCount must be positive, got " + shardCount);
        }
        this.shardCount = shardCount;
    }

    public int shardCount() {
        return shardCount;
    }

    /**
     * @throws IllegalArgumentException if the id is not a valid user id
     */
    public int shardOf(String userId) {
        return shardOf(UserIds.parse(userId), shardCount);
    }

    public static int shardOf(long userId, int shardCount) {
        if (shardCount < 1) {
            throw new IllegalArgumentException("shardCount must be positive, got " + shardCount);
        }
        // remainder first: Math.abs(Long.MIN_VALUE) is negative
        int index = (int) Math.abs(userId % shardCount);
        return index == 0 ? shardCount : index;
    }
}
