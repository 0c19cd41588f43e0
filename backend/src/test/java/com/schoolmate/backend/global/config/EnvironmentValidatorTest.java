package com.schoolmate.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private static final String DEV_SECRET = "dev-jwt-secret-key-change-in-production-2025";

    @Test
    void completeConfigurationPasses() {
        EnvironmentValidator validator = new EnvironmentValidator(validEnvironment());

        assertThat(validator.collectProblems()).isEmpty();
    }

    @Test
    void missingPropertiesAreListed() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("jwt.secret", "a-sufficiently-long-secret-for-hmac-sha256");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactlyInAnyOrder("spring.datasource.url is missing", "app.cors.allowed-origins is missing");
    }

    @Test
    void shortSecretIsRejected() {
        MockEnvironment environment = validEnvironment().withProperty("jwt.secret", "too-short");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("at least 32 characters");
    }

    @Test
    void developmentSecretIsOnlyRejectedInStrictMode() {
        MockEnvironment relaxed = validEnvironment().withProperty("jwt.secret", DEV_SECRET);
        MockEnvironment strict = validEnvironment()
                .withProperty("jwt.secret", DEV_SECRET)
                .withProperty("schoolmate.environment.strict", "true");

        assertThat(new EnvironmentValidator(relaxed).collectProblems()).isEmpty();
        assertThat(new EnvironmentValidator(strict).collectProblems())
                .containsExactly("jwt.secret still uses the development default");
    }

    private static MockEnvironment validEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/schoolmate")
                .withProperty("jwt.secret", "a-sufficiently-long-secret-for-hmac-sha256")
                .withProperty("app.cors.allowed-origins", "http://localhost:3000");
    }
}
