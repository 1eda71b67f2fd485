package com.shardchat.gateway.cluster;

import com.shardchat.gateway.cluster.model.ShardDescriptor;

import java.util.Comparator;
import java.util.List;

/**
 * Static table of shards, ids 1..N with no gaps.
 */
public class ShardTable {

    private final List<ShardDescriptor> shards;

    public ShardTable(List<ShardDescriptor> shards) {
        List<ShardDescriptor> sorted = shards.stream()
                .sorted(Comparator.comparingInt(ShardDescriptor::id))
                .toList();
        if (sorted.isEmpty()) {
            throw new IllegalArgumentException("At least one shard must be configured");
        }
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i).id() != i + 1) {
                throw new IllegalArgumentException("Shard ids must be exactly 1.." + sorted.size()
                        + ", found " + sorted.stream().map(ShardDescriptor::id).toList());
            }
        }
        this.shards = sorted;
    }

    public ShardDescriptor get(int shardId) {
        if (shardId < 1 || shardId > shards.size()) {
            throw new IllegalArgumentException("Unknown shard " + shardId);
        }
        return shards.get(shardId - 1);
    }

    public List<ShardDescriptor> shards() {
        return shards;
    }

    public int size() {
        return shards.size();
    }
}
