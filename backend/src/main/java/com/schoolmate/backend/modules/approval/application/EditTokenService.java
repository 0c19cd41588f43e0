package com.schoolmate.backend.modules.approval.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.schoolmate.backend.global.error.ProblemException;
import com.schoolmate.backend.global.ratelimit.RateLimitGuard;
import com.schoolmate.backend.global.ratelimit.RateLimitProperties;
import com.schoolmate.backend.global.web.ClientRequestInfo;
import com.schoolmate.backend.modules.approval.domain.EditTokenCodec;
import com.schoolmate.backend.modules.approval.domain.SchoolProfileEditToken;
import com.schoolmate.backend.modules.approval.domain.TokenRejection;
import com.schoolmate.backend.modules.approval.domain.TokenVerificationException;
import com.schoolmate.backend.modules.approval.infrastructure.persistence.SchoolProfileEditTokenRepository;
import com.schoolmate.backend.modules.permission.application.CallerContext;
import com.schoolmate.backend.modules.school.domain.School;
import com.schoolmate.backend.modules.school.domain.SchoolProfileChanges;
import com.schoolmate.backend.modules.school.domain.SchoolSnapshot;
import com.schoolmate.backend.modules.school.infrastructure.persistence.SchoolRepository;
import com.schoolmate.backend.modules.staff.domain.SchoolAdmin;
import com.schoolmate.backend.modules.staff.infrastructure.persistence.SchoolAdminRepository;
import com.schoolmate.backend.modules.tenant.domain.SchoolContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues and verifies single-use tokens that approve a sensitive school profile change.
 * <p>
 * Lifecycle: issued, then exactly one of consumed (verified once), expired (checked lazily on
 * verification) or removed by {@link #cleanupExpired(CallerContext)}.
 */
@Service
public class EditTokenService {

    private static final Logger log = LoggerFactory.getLogger(EditTokenService.class);
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final SchoolProfileEditTokenRepository tokenRepository;
    private final SchoolRepository schoolRepository;
    private final SchoolAdminRepository schoolAdminRepository;
    private final RateLimitGuard rateLimitGuard;
    private final RateLimitProperties rateLimitProperties;
    private final ApprovalProperties approvalProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EditTokenService(
            SchoolProfileEditTokenRepository tokenRepository,
            SchoolRepository schoolRepository,
            SchoolAdminRepository schoolAdminRepository,
            RateLimitGuard rateLimitGuard,
            RateLimitProperties rateLimitProperties,
            ApprovalProperties approvalProperties,
            ApplicationEventPublisher eventPublisher,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.tokenRepository = tokenRepository;
        this.schoolRepository = schoolRepository;
        this.schoolAdminRepository = schoolAdminRepository;
        this.rateLimitGuard = rateLimitGuard;
        this.rateLimitProperties = rateLimitProperties;
        this.approvalProperties = approvalProperties;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Transactional
    public EditTokenAcknowledgement requestToken(
            SchoolContext context,
            SchoolProfileChanges proposedChanges,
            ClientRequestInfo client
    ) {
        rateLimitGuard.enforce("edit-token:request:" + context.actorId(), rateLimitProperties.editTokenRequest());

        School school = schoolRepository.findById(context.schoolId())
                .orElseThrow(() -> ProblemException.notFound("school.not_found", "School not found"));

        if (proposedChanges == null || !school.differsFrom(proposedChanges.levels())) {
            throw ProblemException.invalidInput(
                    "approval.no_sensitive_change",
                    "No sensitive changes detected. You can update these fields directly without verification."
            );
        }
        if (proposedChanges.touchesRestrictedFields()) {
            throw ProblemException.invalidInput(
                    "school.restricted_fields",
                    "You do not have permission to change restricted fields (subdomain, active)"
            );
        }

        SchoolAdmin principal = schoolAdminRepository.findPrincipalContacts(school.getId()).stream()
                .filter(candidate -> candidate.getEmail() != null && !candidate.getEmail().isBlank())
                .findFirst()
                .orElseThrow(() -> ProblemException.invalidInput(
                        "approval.principal_contact_missing",
                        "Principal email not found. Please ensure your school has a principal with an email address."
                ));

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime expiresAt = now.plus(approvalProperties.tokenTtl());
        String rawToken = EditTokenCodec.generate();

        SchoolProfileEditToken token = new SchoolProfileEditToken(
                EditTokenCodec.hash(rawToken),
                school.getId(),
                context.actorId(),
                objectMapper.convertValue(proposedChanges, PAYLOAD_TYPE),
                now,
                expiresAt
        );
        token.setIpAddress(client.ipAddress());
        token.setUserAgent(client.userAgent());
        tokenRepository.save(token);

        eventPublisher.publishEvent(new EditTokenIssuedEvent(
                school.getId(),
                school.getName(),
                principal.getEmail(),
                principal.getFullName(),
                rawToken,
                expiresAt,
                proposedChanges
        ));
        log.info("Edit token issued school={} actor={} expiresAt={} ip={}",
                school.getId(), context.actorId(), expiresAt, client.ipAddress());

        return new EditTokenAcknowledgement(true, maskEmail(principal.getEmail()), expiresAt);
    }

    /**
     * Verifies and consumes a token. Exactly one of several concurrent calls with the same token can
     * succeed; the others fail with {@link TokenRejection#TOKEN_ALREADY_USED}.
     */
    @Transactional
    public VerifiedEditToken verifyToken(String rawToken, SchoolContext context, ClientRequestInfo client) {
        rateLimitGuard.enforce("edit-token:verify:" + context.actorId(), rateLimitProperties.editTokenVerify());

        if (!EditTokenCodec.isWellFormed(rawToken)) {
            throw reject(TokenRejection.INVALID_TOKEN, context, client, null);
        }
        SchoolProfileEditToken token = tokenRepository.findByTokenHash(EditTokenCodec.hash(rawToken))
                .orElseThrow(() -> reject(TokenRejection.INVALID_TOKEN, context, client, null));

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (token.isExpiredAt(now)) {
            throw reject(TokenRejection.TOKEN_EXPIRED, context, client, token.getId());
        }
        if (token.isUsed()) {
            throw reject(TokenRejection.TOKEN_ALREADY_USED, context, client, token.getId());
        }
        if (!token.getSchoolId().equals(context.schoolId()) || !token.getActorId().equals(context.actorId())) {
            throw reject(TokenRejection.ACTOR_MISMATCH, context, client, token.getId());
        }

        UUID tokenId = token.getId();
        Map<String, Object> payload = token.getProposedChanges();
        if (tokenRepository.markUsed(tokenId, now) == 0) {
            throw reject(TokenRejection.TOKEN_ALREADY_USED, context, client, tokenId);
        }

        School school = schoolRepository.findById(context.schoolId())
                .orElseThrow(() -> ProblemException.notFound("school.not_found", "School not found"));
        log.info("Edit token consumed token={} school={} actor={} ip={}",
                tokenId, context.schoolId(), context.actorId(), client.ipAddress());
        return new VerifiedEditToken(
                objectMapper.convertValue(payload, SchoolProfileChanges.class),
                SchoolSnapshot.of(school)
        );
    }

    @Transactional
    public int cleanupExpired(CallerContext caller) {
        if (caller == null || !caller.platform()) {
            throw ProblemException.forbidden("approval.cleanup_forbidden", "Only platform operators may purge edit tokens");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        int deleted = tokenRepository.deleteExpiredOrConsumed(now, now.minus(approvalProperties.consumedRetention()));
        log.info("Edit token cleanup removed={} by={}", deleted, caller.userId());
        return deleted;
    }

    static String maskEmail(String email) {
        int at = email.indexOf('@');
        if (at <= 0) {
            return "***";
        }
        String local = email.substring(0, at);
        String visible = local.substring(0, 1);
        return visible + "***" + email.substring(at);
    }

    private TokenVerificationException reject(
            TokenRejection rejection,
            SchoolContext context,
            ClientRequestInfo client,
            UUID tokenId
    ) {
        log.warn("Edit token rejected reason={} token={} school={} actor={} ip={} userAgent={}",
                rejection, tokenId, context.schoolId(), context.actorId(), client.ipAddress(), client.userAgent());
        return new TokenVerificationException(rejection);
    }
}
