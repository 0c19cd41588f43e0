package com.schoolmate.backend.global.ratelimit;

import java.time.Duration;
import java.util.List;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Fixed-window limiter backed by Redis so counters are shared across instances.
 */
public class RedisRateLimiter implements RateLimiter {

    // 0 while the window still has room, otherwise the window's remaining millis (at least 1)
    static final RedisScript<Long> INCREMENT_SCRIPT = RedisScript.of("""
            local count = redis.call('INCR', KEYS[1])
            if count == 1 then
                redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            if count <= tonumber(ARGV[2]) then
                return 0
            end
            local ttl = redis.call('PTTL', KEYS[1])
            if ttl < 1 then
                return tonumber(ARGV[1])
            end
            return ttl
            """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisRateLimiter(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public RateLimitDecision checkAndIncrement(String key, Duration window, int limit) {
        Long retryAfterMillis = redisTemplate.execute(
                INCREMENT_SCRIPT,
                List.of(keyPrefix + key),
                String.valueOf(window.toMillis()),
                String.valueOf(limit)
        );
        if (retryAfterMillis == null) {
            throw new IllegalStateException("Unexpected rate limit script result for key " + key);
        }
        if (retryAfterMillis == 0L) {
            return RateLimitDecision.allow();
        }
        return RateLimitDecision.reject(Duration.ofMillis(retryAfterMillis));
    }
}
