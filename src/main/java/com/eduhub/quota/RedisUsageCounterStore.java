package com.eduhub.quota;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Usage counters shared through Redis.
 *
 * Check and increment run in one Lua script so concurrent nodes can never
 * push a counter past its limit. Windowed counters carry a TTL that ends
 * with their window.
 */
@Component
@ConditionalOnProperty(name = "eduhub.quota.store", havingValue = "redis")
public class RedisUsageCounterStore implements UsageCounterStore {
    
    static final String KEY_PREFIX = "usage:";
    
    // Returns {applied, value}
    private static final String INCREMENT_SCRIPT = """
        local current = tonumber(redis.call('GET', KEYS[1]) or '0')
        local amount = tonumber(ARGV[1])
        local limit = tonumber(ARGV[2])
        local ttl = tonumber(ARGV[3])

        if current + amount > limit then
            return {0, current}
        end

        local updated = redis.call('INCRBY', KEYS[1], amount)
        if ttl > 0 and redis.call('TTL', KEYS[1]) < 0 then
            redis.call('EXPIRE', KEYS[1], ttl)
        end
        return {1, updated}
    """;
    
    private static final String RELEASE_SCRIPT = """
        local current = tonumber(redis.call('GET', KEYS[1]) or '0')
        local updated = math.max(0, current - tonumber(ARGV[1]))
        if redis.call('EXISTS', KEYS[1]) == 1 then
            redis.call('SET', KEYS[1], updated, 'KEEPTTL')
        end
        return updated
    """;
    
    @SuppressWarnings("rawtypes")
    private static final RedisScript<List> INCREMENT = RedisScript.of(INCREMENT_SCRIPT, List.class);
    private static final RedisScript<Long> RELEASE = RedisScript.of(RELEASE_SCRIPT, Long.class);
    
    private final RedisTemplate<String, String> redis;
    private final Clock clock;
    
    public RedisUsageCounterStore(RedisTemplate<String, String> redis, Clock clock) {
        this.redis = redis;
        this.clock = clock;
    }
    
    @Override
    public CounterUpdate tryIncrement(String key, long amount, long limit, Instant expiresAt) {
        List<?> result = redis.execute(
            INCREMENT,
            Collections.singletonList(KEY_PREFIX + key),
            String.valueOf(amount),
            String.valueOf(limit),
            String.valueOf(ttlSeconds(expiresAt)));
        
        if (result == null || result.size() < 2) {
            throw new IllegalStateException("Unexpected reply from usage counter script for " + key);
        }
        boolean applied = toLong(result.get(0)) == 1L;
        long value = toLong(result.get(1));
        return applied ? CounterUpdate.applied(value) : CounterUpdate.refused(value);
    }
    
    @Override
    public long release(String key, long amount) {
        Long result = redis.execute(RELEASE, Collections.singletonList(KEY_PREFIX + key), String.valueOf(amount));
        return result != null ? result : 0L;
    }
    
    @Override
    public long current(String key) {
        String value = redis.opsForValue().get(KEY_PREFIX + key);
        return value != null ? Long.parseLong(value) : 0L;
    }
    
    private long ttlSeconds(Instant expiresAt) {
        if (expiresAt == null) {
            return 0L;
        }
        return Math.max(1L, Duration.between(clock.instant(), expiresAt).getSeconds());
    }
    
    private static long toLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }
}
