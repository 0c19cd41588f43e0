package com.schoolmate.backend.global.ratelimit;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RateLimitMaintenanceScheduler {

    private final RateLimiter rateLimiter;

    public RateLimitMaintenanceScheduler(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(fixedDelayString = "${schoolmate.rate-limit.eviction-interval:PT5M}")
    public void evictExpiredWindows() {
        rateLimiter.evictExpired();
    }
}
