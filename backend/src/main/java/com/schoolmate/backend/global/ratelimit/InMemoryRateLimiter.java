package com.schoolmate.backend.global.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-node limiter. Counters live in this JVM only, so multi-instance deployments should use
 * {@link RedisRateLimiter}.
 */
public class InMemoryRateLimiter implements RateLimiter {

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRateLimiter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public RateLimitDecision checkAndIncrement(String key, Duration window, int limit) {
        Instant now = clock.instant();
        Window current = windows.compute(key, (k, existing) -> {
            if (existing == null || !now.isBefore(existing.resetAt())) {
                return new Window(1, now.plus(window));
            }
            return new Window(existing.count() + 1, existing.resetAt());
        });
        if (current.count() <= limit) {
            return RateLimitDecision.allow();
        }
        return RateLimitDecision.reject(Duration.between(now, current.resetAt()));
    }

    @Override
    public void evictExpired() {
        Instant now = clock.instant();
        windows.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().resetAt()));
    }

    int trackedKeys() {
        return windows.size();
    }

    private record Window(long count, Instant resetAt) {
    }
}
