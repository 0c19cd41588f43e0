package com.schoolmate.backend.modules.permission.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.schoolmate.backend.modules.staff.domain.SchoolAdmin;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "staff_permission", uniqueConstraints = @UniqueConstraint(name = "uq_staff_permission_admin_permission",
        columnNames = {"admin_id", "permission_id"}))
public class StaffPermission {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "admin_id", nullable = false, updatable = false)
    private SchoolAdmin admin;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "permission_id", nullable = false, updatable = false)
    private Permission permission;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected StaffPermission() {
    }

    public StaffPermission(SchoolAdmin admin, Permission permission, OffsetDateTime createdAt) {
        this.admin = admin;
        this.permission = permission;
        this.createdAt = createdAt;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public UUID getId() {
        return id;
    }

    public SchoolAdmin getAdmin() {
        return admin;
    }

    public Permission getPermission() {
        return permission;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
