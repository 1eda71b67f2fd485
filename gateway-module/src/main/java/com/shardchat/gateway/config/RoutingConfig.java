package com.shardchat.gateway.config;

import com.shardchat.gateway.cluster.ShardTable;
import com.shardchat.gateway.cluster.model.ShardDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Slf4j
@Configuration
public class RoutingConfig {

    @Bean
    public ShardTable shardTable(GatewayProperties properties) {
        List<ShardDescriptor> shards = properties.getShards().stream()
                .map(shard -> new ShardDescriptor(shard.getId(), shard.getEndpoints()))
                .toList();
        ShardTable table = new ShardTable(shards);
        table.shards().forEach(shard -> log.info("Shard {}: endpoints {}", shard.id(), shard.endpoints()));
        return table;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
