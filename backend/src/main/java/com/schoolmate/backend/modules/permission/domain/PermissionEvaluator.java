package com.schoolmate.backend.modules.permission.domain;

/**
 * Allow/deny decisions over an {@link ActorGrants} snapshot. Never touches storage.
 */
public final class PermissionEvaluator {

    private PermissionEvaluator() {
    }

    public static boolean hasPermission(ActorGrants actor, PermissionResource resource, PermissionType type) {
        if (actor == null) {
            return false;
        }
        if (actor.fullAccess()) {
            return true;
        }
        if (actor.holds(resource, PermissionType.ADMIN)) {
            return true;
        }
        return actor.holds(resource, type);
    }

    public static boolean hasAdminAccess(ActorGrants actor, PermissionResource resource) {
        if (actor == null) {
            return false;
        }
        return actor.fullAccess() || actor.holds(resource, PermissionType.ADMIN);
    }
}
