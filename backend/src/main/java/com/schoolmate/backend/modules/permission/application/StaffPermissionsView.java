package com.schoolmate.backend.modules.permission.application;

import java.util.List;
import java.util.UUID;

/**
 * An administrator's role and explicit grants. Principals report {@code fullAccess=true} and no
 * grants.
 */
public record StaffPermissionsView(
        UUID adminId,
        String adminName,
        String role,
        boolean fullAccess,
        List<PermissionView> permissions
) {
}
