package com.schoolmate.backend.modules.permission.domain;

import java.util.Set;
import java.util.UUID;

/**
 * Authorization snapshot of one administrator: the Principal flag plus the explicitly granted keys.
 * A Principal snapshot never carries grants.
 */
public record ActorGrants(UUID adminId, String role, boolean fullAccess, Set<PermissionKey> grants) {

    public ActorGrants {
        grants = fullAccess || grants == null ? Set.of() : Set.copyOf(grants);
    }

    public static ActorGrants principal(UUID adminId, String role) {
        return new ActorGrants(adminId, role, true, Set.of());
    }

    public boolean holds(PermissionResource resource, PermissionType type) {
        return grants.contains(new PermissionKey(resource, type));
    }
}
