package com.schoolmate.backend.modules.approval.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.schoolmate.backend.modules.school.domain.SchoolProfileChanges;

/**
 * Carries the raw token to the out-of-band dispatcher. Never serialized or persisted.
 */
public record EditTokenIssuedEvent(
        UUID schoolId,
        String schoolName,
        String recipientEmail,
        String recipientName,
        String token,
        OffsetDateTime expiresAt,
        SchoolProfileChanges proposedChanges
) {

    @Override
    public String toString() {
        return "EditTokenIssuedEvent[schoolId=" + schoolId + ", recipient=" + recipientEmail
                + ", expiresAt=" + expiresAt + "]";
    }
}
