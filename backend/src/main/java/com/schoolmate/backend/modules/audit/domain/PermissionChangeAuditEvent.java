package com.schoolmate.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Typed record of one grant replacement. {@code callerUserId} is null when the change was made by
 * the system (migration, platform tooling without a user).
 */
public record PermissionChangeAuditEvent(
        OffsetDateTime occurredAt,
        UUID schoolId,
        UUID targetAdminId,
        String targetAdminName,
        String targetAdminRole,
        UUID callerUserId,
        String callerIp,
        int previousPermissionCount,
        int newPermissionCount,
        List<UUID> addedPermissionIds,
        List<UUID> removedPermissionIds
) {

    public static final String ACTION_TYPE = "PERMISSION_CHANGE";
    public static final String RESOURCE_TYPE = "SCHOOL_ADMIN";
    public static final String SYSTEM_CALLER = "system";

    public PermissionChangeAuditEvent {
        addedPermissionIds = addedPermissionIds == null ? List.of() : List.copyOf(addedPermissionIds);
        removedPermissionIds = removedPermissionIds == null ? List.of() : List.copyOf(removedPermissionIds);
    }

    public String callerLabel() {
        return callerUserId != null ? callerUserId.toString() : SYSTEM_CALLER;
    }

    public Map<String, Object> toDetail() {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("timestamp", occurredAt.toString());
        detail.put("targetAdminName", targetAdminName);
        detail.put("targetAdminRole", targetAdminRole);
        detail.put("callerUserId", callerLabel());
        detail.put("callerIp", callerIp);
        detail.put("previousPermissionCount", previousPermissionCount);
        detail.put("newPermissionCount", newPermissionCount);
        detail.put("permissionsAdded", addedPermissionIds.size());
        detail.put("permissionsRemoved", removedPermissionIds.size());
        detail.put("addedPermissionIds", addedPermissionIds.stream().map(UUID::toString).toList());
        detail.put("removedPermissionIds", removedPermissionIds.stream().map(UUID::toString).toList());
        return detail;
    }
}
