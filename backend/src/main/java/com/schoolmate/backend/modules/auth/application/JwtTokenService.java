package com.schoolmate.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.schoolmate.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Reads the access tokens issued by the identity service. The identity layer owns login and
 * refresh; this back end only needs {@code (userId, roles, schoolId)} from each request.
 */
@Service
public class JwtTokenService {

    private static final String CLAIM_LOGIN_ID = "loginId";
    private static final String CLAIM_ROLES = "roles";
    private static final String CLAIM_SCHOOL_ID = "schoolId";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    /**
     * Issues an access token in the identity service's format. Used by operational tooling and tests.
     */
    public String issueAccessToken(UUID userId, String loginId, List<String> roles, UUID schoolId) {
        Instant now = clock.instant();
        JwtBuilder builder = Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(accessTokenTtlMillis)))
                .claim(CLAIM_LOGIN_ID, loginId)
                .claim(CLAIM_ROLES, roles);
        if (schoolId != null) {
            builder.claim(CLAIM_SCHOOL_ID, schoolId.toString());
        }
        return builder.signWith(tokenProvider.getSecretKey(), SIG.HS256).compact();
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID userId = UUID.fromString(claims.getSubject());
            String loginId = claims.get(CLAIM_LOGIN_ID, String.class);
            List<?> rolesClaim = claims.get(CLAIM_ROLES, List.class);
            List<String> roles = rolesClaim == null ? List.of() : rolesClaim.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();
            String schoolClaim = claims.get(CLAIM_SCHOOL_ID, String.class);
            UUID schoolId = schoolClaim == null || schoolClaim.isBlank() ? null : UUID.fromString(schoolClaim);

            return new ParsedToken(userId, loginId, roles, schoolId);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record ParsedToken(UUID userId, String loginId, List<String> roles, UUID schoolId) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
