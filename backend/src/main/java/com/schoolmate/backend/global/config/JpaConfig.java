package com.schoolmate.backend.global.config;

import java.util.UUID;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.AuditorAware;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Repositories live next to their module; auditing timestamps come from
 * {@link com.schoolmate.backend.global.common.time.TimeConfig#auditingDateTimeProvider}.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.schoolmate.backend.modules")
@EnableJpaAuditing(auditorAwareRef = "schoolmateAuditor", dateTimeProviderRef = "auditingDateTimeProvider")
public class JpaConfig {

    @Bean
    public AuditorAware<UUID> schoolmateAuditor() {
        return new SchoolmateAuditorAware();
    }
}
