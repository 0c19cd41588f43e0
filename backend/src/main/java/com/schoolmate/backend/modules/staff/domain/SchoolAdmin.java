package com.schoolmate.backend.modules.staff.domain;

import java.util.UUID;

import com.schoolmate.backend.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * An administrator acting inside exactly one school.
 * <p>
 * {@code fullAccess} marks the Principal. It is fixed when the row is created and is not derived
 * again from the free-form {@code role} label.
 */
@Entity
@Table(name = "school_admin", uniqueConstraints = @UniqueConstraint(name = "uq_school_admin_school_user",
        columnNames = {"school_id", "user_id"}))
public class SchoolAdmin extends AbstractAuditedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "school_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID schoolId;

    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @Column(name = "email", length = 255)
    private String email;

    @Column(name = "role", nullable = false, length = 100)
    private String role;

    @Column(name = "full_access", nullable = false, updatable = false)
    private boolean fullAccess;

    protected SchoolAdmin() {
    }

    public SchoolAdmin(UUID schoolId, UUID userId, String role, boolean fullAccess) {
        this.schoolId = schoolId;
        this.userId = userId;
        this.role = role;
        this.fullAccess = fullAccess;
    }

    public UUID getId() {
        return id;
    }

    public UUID getSchoolId() {
        return schoolId;
    }

    public UUID getUserId() {
        return userId;
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    public String getFullName() {
        return (firstName + " " + lastName).trim();
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public boolean isFullAccess() {
        return fullAccess;
    }
}
