package com.schoolmate.backend.global.ratelimit;

import java.time.Duration;

public record RateLimitDecision(boolean allowed, Duration retryAfter) {

    public static RateLimitDecision allow() {
        return new RateLimitDecision(true, Duration.ZERO);
    }

    public static RateLimitDecision reject(Duration retryAfter) {
        return new RateLimitDecision(false, retryAfter.isNegative() ? Duration.ZERO : retryAfter);
    }

    /**
     * Retry-After header value, rounded up to whole seconds and never below one for rejections.
     */
    public long retryAfterSeconds() {
        if (allowed) {
            return 0;
        }
        long millis = retryAfter.toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }
}
