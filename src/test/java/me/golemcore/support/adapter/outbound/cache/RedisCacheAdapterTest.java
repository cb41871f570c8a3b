package me.golemcore.support.adapter.outbound.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RedisCacheAdapterTest {

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private RedisCacheAdapter cache;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        cache = new RedisCacheAdapter(redisTemplate);
    }

    @Test
    void get_returnsStoredValue() {
        when(valueOperations.get("key")).thenReturn("value");

        assertEquals("value", cache.get("key").orElseThrow());
    }

    @Test
    void get_redisErrorIsMiss() {
        when(valueOperations.get("key")).thenThrow(new RedisConnectionFailureException("down"));

        assertTrue(cache.get("key").isEmpty());
    }

    @Test
    void set_passesTtl() {
        cache.set("key", "value", Duration.ofMinutes(5));

        verify(valueOperations).set("key", "value", Duration.ofMinutes(5));
    }

    @Test
    void set_redisErrorIsAbsorbed() {
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

        assertDoesNotThrow(() -> cache.set("key", "value", Duration.ofMinutes(5)));
    }

    @Test
    void delete_redisErrorIsAbsorbed() {
        when(redisTemplate.delete("key")).thenThrow(new RedisConnectionFailureException("down"));

        assertDoesNotThrow(() -> cache.delete("key"));
        verify(redisTemplate).delete("key");
    }
}
