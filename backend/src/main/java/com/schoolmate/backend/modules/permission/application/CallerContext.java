package com.schoolmate.backend.modules.permission.application;

import java.util.UUID;

import com.schoolmate.backend.global.security.JwtAuthenticationPrincipal;

/**
 * Who is asking for a grant change. A {@code null} user id means the system itself; platform
 * callers are not subject to tenant-level authority checks.
 */
public record CallerContext(UUID userId, boolean platform, String ipAddress) {

    public static CallerContext system() {
        return new CallerContext(null, true, null);
    }

    public static CallerContext of(JwtAuthenticationPrincipal principal, String ipAddress) {
        return new CallerContext(principal.userId(), principal.isPlatformAdmin(), ipAddress);
    }

    public boolean isTenantScoped() {
        return userId != null && !platform;
    }
}
