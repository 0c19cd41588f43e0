package com.schoolmate.backend.global.security;

import java.util.List;
import java.util.UUID;

/**
 * Authenticated caller as carried by the access token. {@code currentSchoolId} is the school the
 * user signed in to and is absent for platform accounts.
 */
public record JwtAuthenticationPrincipal(UUID userId, String loginId, List<String> roles, UUID currentSchoolId) {

    public static final String ROLE_SUPER_ADMIN = "SUPER_ADMIN";
    public static final String ROLE_SCHOOL_ADMIN = "SCHOOL_ADMIN";

    public JwtAuthenticationPrincipal {
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public boolean isPlatformAdmin() {
        return roles.contains(ROLE_SUPER_ADMIN);
    }

    public boolean isSchoolAdmin() {
        return roles.contains(ROLE_SCHOOL_ADMIN);
    }
}
