package com.schoolmate.backend.modules.permission.domain;

import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * Catalog entry. Rows are created by the catalog bootstrap and are read-only afterwards.
 */
@Entity
@Table(name = "permission", uniqueConstraints = @UniqueConstraint(name = "uq_permission_resource_type",
        columnNames = {"resource", "type"}))
public class Permission {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "resource", nullable = false, length = 32, updatable = false)
    private PermissionResource resource;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 16, updatable = false)
    private PermissionType type;

    @Column(name = "description", length = 255)
    private String description;

    protected Permission() {
    }

    public Permission(UUID id, PermissionResource resource, PermissionType type, String description) {
        this.id = id;
        this.resource = resource;
        this.type = type;
        this.description = description;
    }

    public UUID getId() {
        return id;
    }

    public PermissionResource getResource() {
        return resource;
    }

    public PermissionType getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public PermissionKey key() {
        return new PermissionKey(resource, type);
    }
}
