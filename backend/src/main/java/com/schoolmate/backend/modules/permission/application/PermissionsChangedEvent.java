package com.schoolmate.backend.modules.permission.application;

import java.util.List;
import java.util.UUID;

/**
 * Published inside the grant transaction; listeners act on it only after commit.
 */
public record PermissionsChangedEvent(
        UUID schoolId,
        UUID adminId,
        String adminName,
        String adminEmail,
        List<PermissionView> permissions
) {

    public PermissionsChangedEvent {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }
}
