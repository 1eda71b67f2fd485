package com.shardchat.shard.config;

import com.shardchat.shard.cache.LocalMessageCache;
import com.shardchat.shard.cache.MessageCache;
import com.shardchat.shard.cache.RedisMessageCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(prefix = "shard.cache", name = "type", havingValue = "local", matchIfMissing = true)
    public MessageCache localMessageCache(ShardProperties properties, Clock clock) {
        ShardProperties.Cache cache = properties.getCache();
        log.info("Using in-process message cache (max {} entries, ttl {})", cache.getMaximumSize(), cache.getTtl());
        return new LocalMessageCache(cache.getMaximumSize(), cache.getTtl(), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "shard.cache", name = "type", havingValue = "redis")
    public MessageCache redisMessageCache(StringRedisTemplate redisTemplate) {
        log.info("Using Redis message cache");
        return new RedisMessageCache(redisTemplate);
    }
}
