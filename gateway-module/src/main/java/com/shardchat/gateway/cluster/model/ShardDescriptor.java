package com.shardchat.gateway.cluster.model;

import java.net.URI;
import java.util.List;

/**
 * One shard and its endpoints in failover order.
 */
public record ShardDescriptor(int id, List<URI> endpoints) {

    public ShardDescriptor {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("Shard " + id + " needs at least one endpoint");
        }
        endpoints = List.copyOf(endpoints);
    }

    public URI primary() {
        return endpoints.get(0);
    }
}
