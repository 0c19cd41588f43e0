package com.schoolmate.backend.global.config;

import java.time.Clock;

import com.schoolmate.backend.global.ratelimit.InMemoryRateLimiter;
import com.schoolmate.backend.global.ratelimit.RateLimitProperties;
import com.schoolmate.backend.global.ratelimit.RateLimiter;
import com.schoolmate.backend.global.ratelimit.RedisRateLimiter;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the rate-limit counter store. Redis is used only when
 * {@code schoolmate.rate-limit.store=redis}; the in-memory store is the fallback.
 */
@Configuration(proxyBeanMethods = false)
public class RedisConfig {

    @Bean
    @ConditionalOnProperty(value = "schoolmate.rate-limit.store", havingValue = "redis")
    public RateLimiter redisRateLimiter(StringRedisTemplate redisTemplate, RateLimitProperties properties) {
        return new RedisRateLimiter(redisTemplate, properties.keyPrefix());
    }

    @Bean
    @ConditionalOnMissingBean(RateLimiter.class)
    public RateLimiter inMemoryRateLimiter(Clock clock) {
        return new InMemoryRateLimiter(clock);
    }
}
