package com.shardchat.gateway.cluster.router;

import com.shardchat.common.routing.ShardAssigner;
import com.shardchat.gateway.cluster.ShardTable;
import com.shardchat.gateway.cluster.model.ShardDescriptor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Resolves the shard owning a user, with the same assignment function the shard nodes use.
 */
@Component
public class ShardRouter {

    private final ShardTable shardTable;
    private final ShardAssigner shardAssigner;

    public ShardRouter(ShardTable shardTable) {
        this.shardTable = shardTable;
        this.shardAssigner = new ShardAssigner(shardTable.size());
    }

    /**
     * @throws IllegalArgumentException if the user id is not valid
     */
    public ShardDescriptor route(String userId) {
        return shardTable.get(shardAssigner.shardOf(userId));
    }

    public List<ShardDescriptor> allShards() {
        return shardTable.shards();
    }
}
