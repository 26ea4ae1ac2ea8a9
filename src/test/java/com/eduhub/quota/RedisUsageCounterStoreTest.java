package com.eduhub.quota;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RedisUsageCounterStore with a mocked RedisTemplate.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RedisUsageCounterStore Tests")
class RedisUsageCounterStoreTest {
    
    private static final Instant NOW = Instant.parse("2026-03-10T23:00:00Z");
    
    @Mock
    private RedisTemplate<String, String> redisTemplate;
    
    @Mock
    private ValueOperations<String, String> valueOperations;
    
    private RedisUsageCounterStore store;
    
    @BeforeEach
    void setUp() {
        store = new RedisUsageCounterStore(redisTemplate, new MutableClock(NOW));
    }
    
    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should pass amount, limit and window TTL to the increment script")
    void shouldRunIncrementScript() {
        // Given
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any(), any()))
            .thenReturn(List.of(1L, 5L));
        
        // When
        CounterUpdate update = store.tryIncrement("t1:api_calls:2026-03-10", 1, 100, NOW.plus(Duration.ofHours(1)));
        
        // Then
        assertThat(update.isApplied()).isTrue();
        assertThat(update.getValue()).isEqualTo(5L);
        verify(redisTemplate).execute(any(RedisScript.class),
            eq(Collections.singletonList("usage:t1:api_calls:2026-03-10")), eq("1"), eq("100"), eq("3600"));
    }
    
    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should report refusal with the unchanged value")
    void shouldReportRefusal() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any(), any()))
            .thenReturn(List.of(0L, 25L));
        
        CounterUpdate update = store.tryIncrement("t1:users", 1, 25, null);
        
        assertThat(update.isApplied()).isFalse();
        assertThat(update.getValue()).isEqualTo(25L);
        verify(redisTemplate).execute(any(RedisScript.class), anyList(), eq("1"), eq("25"), eq("0"));
    }
    
    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should fail on a malformed script reply")
    void shouldFailOnMalformedReply() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any(), any())).thenReturn(null);
        
        assertThatThrownBy(() -> store.tryIncrement("t1:users", 1, 25, null))
            .isInstanceOf(IllegalStateException.class);
    }
    
    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("Should release through the floor-at-zero script")
    void shouldRelease() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any())).thenReturn(3L);
        
        assertThat(store.release("t1:students", 2)).isEqualTo(3L);
        verify(redisTemplate).execute(any(RedisScript.class), eq(Collections.singletonList("usage:t1:students")), eq("2"));
    }
    
    @Test
    @DisplayName("Should read missing counters as zero")
    void shouldReadCurrent() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("usage:t1:students")).thenReturn("7");
        when(valueOperations.get("usage:t2:students")).thenReturn(null);
        
        assertThat(store.current("t1:students")).isEqualTo(7L);
        assertThat(store.current("t2:students")).isZero();
    }
}
