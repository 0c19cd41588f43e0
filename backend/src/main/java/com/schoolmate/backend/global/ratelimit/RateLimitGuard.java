package com.schoolmate.backend.global.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.schoolmate.backend.global.error.RetryableProblemException;

/**
 * Applies a configured {@link RateLimitProperties.Rule} and turns rejections into a 429 problem.
 */
@Component
public class RateLimitGuard {

    private static final Logger log = LoggerFactory.getLogger(RateLimitGuard.class);

    private final RateLimiter rateLimiter;

    public RateLimitGuard(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    public void enforce(String key, RateLimitProperties.Rule rule) {
        RateLimitDecision decision = rateLimiter.checkAndIncrement(key, rule.window(), rule.limit());
        if (!decision.allowed()) {
            log.warn("Rate limit exceeded key={} limit={} window={}", key, rule.limit(), rule.window());
            throw new RetryableProblemException(
                    "rate_limit.exceeded",
                    "Too many requests. Please try again later.",
                    decision.retryAfterSeconds()
            );
        }
    }
}
