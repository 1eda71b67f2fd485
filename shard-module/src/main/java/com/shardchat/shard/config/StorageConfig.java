package com.shardchat.shard.config;

import com.shardchat.common.routing.ShardAssigner;
import com.shardchat.shard.id.MessageIdGenerator;
import com.shardchat.shard.id.UuidMessageIdGenerator;
import com.shardchat.shard.store.RocksDbMessageStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class StorageConfig {

    @Bean(initMethod = "open", destroyMethod = "close")
    @Primary
    public RocksDbMessageStore primaryMessageStore(ShardProperties properties) {
        return new RocksDbMessageStore(Path.of(properties.getStorage().getDataPath()), "primary");
    }

    @Bean
    public ShardAssigner shardAssigner(ShardProperties properties) {
        return new ShardAssigner(properties.getCount());
    }

    @Bean
    public MessageIdGenerator messageIdGenerator() {
        return new UuidMessageIdGenerator();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
