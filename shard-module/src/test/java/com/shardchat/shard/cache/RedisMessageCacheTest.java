package com.shardchat.shard.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisMessageCacheTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisMessageCache cache;

    @BeforeEach
    void setUp() {
        cache = new RedisMessageCache(redisTemplate);
    }

    @Test
    void getReturnsStoredValue() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("user:messages:1")).thenReturn("[{\"id\":\"m1\"}]");

        assertThat(cache.get("user:messages:1")).contains("[{\"id\":\"m1\"}]");
    }

    @Test
    void getOfMissingKeyIsEmpty() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("conv:1:2")).thenReturn(null);

        assertThat(cache.get("conv:1:2")).isEmpty();
    }

    @Test
    void putSetsValueWithTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        cache.put("conv:1:2", "page", Duration.ofMinutes(5));

        verify(valueOperations).set("conv:1:2", "page", Duration.ofMinutes(5));
    }

    @Test
    void evictDeletesKey() {
        cache.evict("conv:2:1");

        verify(redisTemplate).delete("conv:2:1");
        verifyNoInteractions(valueOperations);
    }
}
