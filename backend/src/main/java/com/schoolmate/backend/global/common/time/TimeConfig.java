package com.schoolmate.backend.global.common.time;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;

@Configuration
public class TimeConfig {

    /**
     * UTC clock shared by edit-token expiry, rate-limit windows and audit entries. Tests replace it
     * with a fixed clock.
     */
    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    /**
     * Entity {@code created_at}/{@code updated_at} values, read from the same clock and truncated to
     * the microsecond precision PostgreSQL keeps, so a reloaded entity compares equal.
     */
    @Bean
    public DateTimeProvider auditingDateTimeProvider(Clock utcClock) {
        return () -> Optional.of(OffsetDateTime.now(utcClock).truncatedTo(ChronoUnit.MICROS));
    }
}
