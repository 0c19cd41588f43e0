package com.schoolmate.backend.modules.permission.domain;

import java.util.Objects;

public record PermissionKey(PermissionResource resource, PermissionType type) {

    public PermissionKey {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(type, "type");
    }

    public static PermissionKey of(PermissionResource resource, PermissionType type) {
        return new PermissionKey(resource, type);
    }

    public String description() {
        return type.label() + " access to " + resource.displayName();
    }

    @Override
    public String toString() {
        return resource.name() + ":" + type.name();
    }
}
