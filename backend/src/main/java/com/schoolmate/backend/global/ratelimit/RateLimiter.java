package com.schoolmate.backend.global.ratelimit;

import java.time.Duration;

/**
 * Fixed-window counter shared by every caller of a key.
 * Implementations increment and compare atomically so concurrent requests from one actor cannot
 * both slip under the limit.
 */
public interface RateLimiter {

    RateLimitDecision checkAndIncrement(String key, Duration window, int limit);

    /**
     * Drops counters whose window has passed. Stores with native expiry have nothing to do.
     */
    default void evictExpired() {
    }
}
