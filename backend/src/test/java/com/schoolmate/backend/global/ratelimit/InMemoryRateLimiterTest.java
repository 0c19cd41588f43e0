package com.schoolmate.backend.global.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

class InMemoryRateLimiterTest {

    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final MutableClock clock = new MutableClock(Instant.parse("2025-05-01T10:00:00Z"));
    private final InMemoryRateLimiter limiter = new InMemoryRateLimiter(clock);

    @Test
    void allowsUpToLimitThenRejectsWithRemainingWindow() {
        for (int i = 0; i < 5; i++) {
            assertThat(limiter.checkAndIncrement("verify:alice", WINDOW, 5).allowed()).isTrue();
        }
        clock.advance(Duration.ofSeconds(20));

        RateLimitDecision sixth = limiter.checkAndIncrement("verify:alice", WINDOW, 5);

        assertThat(sixth.allowed()).isFalse();
        assertThat(sixth.retryAfterSeconds()).isEqualTo(40);
    }

    @Test
    void keysAreCountedIndependently() {
        assertThat(limiter.checkAndIncrement("a", WINDOW, 1).allowed()).isTrue();
        assertThat(limiter.checkAndIncrement("a", WINDOW, 1).allowed()).isFalse();
        assertThat(limiter.checkAndIncrement("b", WINDOW, 1).allowed()).isTrue();
    }

    @Test
    void windowResetsOnceElapsed() {
        limiter.checkAndIncrement("k", WINDOW, 1);
        assertThat(limiter.checkAndIncrement("k", WINDOW, 1).allowed()).isFalse();

        clock.advance(WINDOW);

        assertThat(limiter.checkAndIncrement("k", WINDOW, 1).allowed()).isTrue();
    }

    @Test
    void evictionDropsOnlyElapsedWindows() {
        limiter.checkAndIncrement("old", Duration.ofSeconds(10), 3);
        limiter.checkAndIncrement("fresh", Duration.ofHours(1), 3);
        clock.advance(Duration.ofSeconds(30));

        limiter.evictExpired();

        assertThat(limiter.trackedKeys()).isEqualTo(1);
    }

    @Test
    void concurrentCallersNeverExceedLimit() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> calls = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                calls.add(() -> limiter.checkAndIncrement("shared", WINDOW, 5).allowed());
            }
            long allowed = 0;
            for (Future<Boolean> result : pool.invokeAll(calls)) {
                if (result.get()) {
                    allowed++;
                }
            }
            assertThat(allowed).isEqualTo(5);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void rejectionAlwaysAsksForAtLeastOneSecond() {
        assertThat(RateLimitDecision.reject(Duration.ofMillis(10)).retryAfterSeconds()).isEqualTo(1);
        assertThat(RateLimitDecision.reject(Duration.ofMillis(1500)).retryAfterSeconds()).isEqualTo(2);
        assertThat(RateLimitDecision.allow().retryAfterSeconds()).isZero();
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        private MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
