package com.schoolmate.backend.modules.approval.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Pending approval for a sensitive school profile change. Only the SHA-256 hash of the delivered
 * token is stored.
 */
@Entity
@Table(name = "school_profile_edit_token")
public class SchoolProfileEditToken {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "token_hash", nullable = false, unique = true, updatable = false, length = 64)
    private String tokenHash;

    @Column(name = "school_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID schoolId;

    @Column(name = "actor_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID actorId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "proposed_changes", nullable = false, updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> proposedChanges;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private OffsetDateTime issuedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "used_at")
    private OffsetDateTime usedAt;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "user_agent", length = 500)
    private String userAgent;

    protected SchoolProfileEditToken() {
    }

    public SchoolProfileEditToken(
            String tokenHash,
            UUID schoolId,
            UUID actorId,
            Map<String, Object> proposedChanges,
            OffsetDateTime issuedAt,
            OffsetDateTime expiresAt
    ) {
        this.tokenHash = tokenHash;
        this.schoolId = schoolId;
        this.actorId = actorId;
        this.proposedChanges = proposedChanges;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
    }

    public UUID getId() {
        return id;
    }

    public String getTokenHash() {
        return tokenHash;
    }

    public UUID getSchoolId() {
        return schoolId;
    }

    public UUID getActorId() {
        return actorId;
    }

    public Map<String, Object> getProposedChanges() {
        return proposedChanges;
    }

    public OffsetDateTime getIssuedAt() {
        return issuedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getUsedAt() {
        return usedAt;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public void setIpAddress(String ipAddress) {
        this.ipAddress = ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public boolean isExpiredAt(OffsetDateTime now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isUsed() {
        return usedAt != null;
    }
}
