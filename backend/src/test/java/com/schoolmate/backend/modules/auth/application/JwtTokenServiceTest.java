package com.schoolmate.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.schoolmate.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.schoolmate.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.schoolmate.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-secret-that-is-long-enough-for-hs256";
    private static final Instant NOW = Instant.parse("2026-03-02T08:00:00Z");

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET);

    @Test
    void tenantClaimSurvivesParsing() {
        JwtTokenService service = serviceAt(NOW);
        UUID userId = UUID.randomUUID();
        UUID schoolId = UUID.randomUUID();

        String token = service.issueAccessToken(userId, "registrar", List.of("SCHOOL_ADMIN"), schoolId);
        ParsedToken parsed = service.parseAccessToken(token);

        assertThat(parsed.userId()).isEqualTo(userId);
        assertThat(parsed.loginId()).isEqualTo("registrar");
        assertThat(parsed.roles()).containsExactly("SCHOOL_ADMIN");
        assertThat(parsed.schoolId()).isEqualTo(schoolId);
    }

    @Test
    void platformTokenHasNoSchool() {
        JwtTokenService service = serviceAt(NOW);

        ParsedToken parsed = service.parseAccessToken(
                service.issueAccessToken(UUID.randomUUID(), "ops", List.of("SUPER_ADMIN"), null));

        assertThat(parsed.schoolId()).isNull();
    }

    @Test
    void expiredTokenIsRejected() {
        String token = serviceAt(NOW).issueAccessToken(UUID.randomUUID(), "registrar", List.of("SCHOOL_ADMIN"), null);

        assertThatThrownBy(() -> serviceAt(NOW.plusSeconds(3600)).parseAccessToken(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenService foreign = new JwtTokenService(
                new JwtTokenProvider("a-completely-different-secret-for-signing-tokens"),
                900_000L,
                Clock.fixed(NOW, ZoneOffset.UTC));
        String token = foreign.issueAccessToken(UUID.randomUUID(), "intruder", List.of("SUPER_ADMIN"), null);

        assertThatThrownBy(() -> serviceAt(NOW).parseAccessToken(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> serviceAt(NOW).parseAccessToken("not-a-jwt"))
                .isInstanceOf(InvalidTokenException.class);
    }

    private JwtTokenService serviceAt(Instant instant) {
        return new JwtTokenService(provider, 900_000L, Clock.fixed(instant, ZoneOffset.UTC));
    }
}
