package com.schoolmate.backend.modules.approval.application;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param tokenTtl          how long an issued edit token stays valid
 * @param consumedRetention how long consumed tokens are kept before cleanup removes them
 */
@ConfigurationProperties(prefix = "schoolmate.approval")
public record ApprovalProperties(Duration tokenTtl, Duration consumedRetention) {

    public ApprovalProperties {
        if (tokenTtl == null) {
            tokenTtl = Duration.ofMinutes(15);
        }
        if (consumedRetention == null) {
            consumedRetention = Duration.ofDays(7);
        }
        if (tokenTtl.isNegative() || tokenTtl.isZero()) {
            throw new IllegalArgumentException("schoolmate.approval.token-ttl must be positive");
        }
    }
}
