package com.schoolmate.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails fast when required settings are missing or still carry development defaults.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);
    private static final String DEV_JWT_SECRET = "dev-jwt-secret-key-change-in-production-2025";
    private static final int MIN_SECRET_BYTES = 32;

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment check failed: {}", problem));
            throw new IllegalStateException("Invalid environment configuration: " + String.join("; ", problems));
        }
        log.info("Environment check passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();
        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(property + " is missing");
            }
        }

        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        boolean strict = environment.getProperty("schoolmate.environment.strict", Boolean.class, false);
        if (strict && jwtSecret.filter(DEV_JWT_SECRET::equals).isPresent()) {
            problems.add("jwt.secret still uses the development default");
        }
        if (jwtSecret.filter(secret -> !secret.isBlank() && secret.length() < MIN_SECRET_BYTES).isPresent()) {
            problems.add("jwt.secret must be at least " + MIN_SECRET_BYTES + " characters for HS256");
        }
        return problems;
    }
}
