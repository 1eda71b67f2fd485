package com.shardchat.gateway.client;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link ShardClient} per endpoint, created on first use.
 */
@Component
@RequiredArgsConstructor
public class ShardClientPool {

    private final ShardClientFactory shardClientFactory;
    private final Map<URI, ShardClient> clients = new ConcurrentHashMap<>();

    public ShardClient get(URI endpoint) {
        return clients.computeIfAbsent(endpoint, shardClientFactory::create);
    }
}
