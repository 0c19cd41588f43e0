package com.schoolmate.backend.global.ratelimit;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "schoolmate.rate-limit")
public record RateLimitProperties(
        Store store,
        String keyPrefix,
        Rule editTokenRequest,
        Rule editTokenVerify
) {

    public enum Store {
        MEMORY,
        REDIS
    }

    public record Rule(int limit, Duration window) {

        public Rule {
            if (limit < 1) {
                throw new IllegalArgumentException("rate limit must be at least 1");
            }
            if (window == null || window.isZero() || window.isNegative()) {
                throw new IllegalArgumentException("rate limit window must be positive");
            }
        }
    }

    public RateLimitProperties {
        if (store == null) {
            store = Store.MEMORY;
        }
        if (keyPrefix == null || keyPrefix.isBlank()) {
            keyPrefix = "schoolmate:rl:";
        }
        if (editTokenRequest == null) {
            editTokenRequest = new Rule(3, Duration.ofHours(1));
        }
        if (editTokenVerify == null) {
            editTokenVerify = new Rule(5, Duration.ofMinutes(1));
        }
    }
}
