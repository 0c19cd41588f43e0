package com.schoolmate.backend.modules.permission.application;

import java.util.UUID;

import com.schoolmate.backend.modules.permission.domain.Permission;
import com.schoolmate.backend.modules.permission.domain.PermissionResource;
import com.schoolmate.backend.modules.permission.domain.PermissionType;

public record PermissionView(UUID id, PermissionResource resource, PermissionType type, String description) {

    public static PermissionView from(Permission permission) {
        return new PermissionView(
                permission.getId(),
                permission.getResource(),
                permission.getType(),
                permission.getDescription()
        );
    }
}
