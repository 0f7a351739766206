package com.muzee.auth.kv;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RedisKeyValueStoreTest {

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private RedisKeyValueStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        store = new RedisKeyValueStore(redisTemplate);
    }

    @Test
    void firstIncrementSetsExpiry() {
        when(valueOps.increment("k")).thenReturn(1L);

        long count = store.incrementAndExpire("k", Duration.ofMinutes(5));

        assertThat(count).isEqualTo(1L);
        verify(redisTemplate).expire("k", Duration.ofMinutes(5));
    }

    @Test
    void laterIncrementsKeepExistingExpiry() {
        when(valueOps.increment("k")).thenReturn(2L);

        store.incrementAndExpire("k", Duration.ofMinutes(5));

        verify(redisTemplate, never()).expire(anyString(), any(Duration.class));
    }

    @Test
    void missingIncrementResultIsAnError() {
        when(valueOps.increment("k")).thenReturn(null);

        assertThatThrownBy(() -> store.incrementAndExpire("k", Duration.ofMinutes(5)))
                .isInstanceOf(RedisSystemException.class);
    }

    @Test
    void deleteReportsWhetherKeyExisted() {
        when(redisTemplate.delete("present")).thenReturn(true);
        when(redisTemplate.delete("absent")).thenReturn(false);

        assertThat(store.delete("present")).isTrue();
        assertThat(store.delete("absent")).isFalse();
    }

    @Test
    void setWritesWithTtl() {
        store.set("k", "v", Duration.ofDays(30));

        verify(valueOps).set("k", "v", Duration.ofDays(30));
    }
}
