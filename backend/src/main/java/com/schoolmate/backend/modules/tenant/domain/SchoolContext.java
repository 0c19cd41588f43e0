package com.schoolmate.backend.modules.tenant.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * The school a request operates on.
 *
 * @param schoolId      resolved tenant
 * @param userId        authenticated user
 * @param platformScope true when a platform operator acts on behalf of the school
 * @param adminId       the caller's administrator record in the school; {@code null} for platform scope
 */
public record SchoolContext(UUID schoolId, UUID userId, boolean platformScope, UUID adminId) {

    public SchoolContext {
        Objects.requireNonNull(schoolId, "schoolId");
        Objects.requireNonNull(userId, "userId");
    }

    /**
     * Identity that approval tokens are bound to.
     */
    public UUID actorId() {
        return adminId != null ? adminId : userId;
    }
}
