package com.schoolmate.backend.modules.school.domain;

import java.util.UUID;

import com.schoolmate.backend.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "school")
public class School extends AbstractAuditedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "subdomain", nullable = false, unique = true, length = 63)
    private String subdomain;

    @Column(name = "address", length = 500)
    private String address;

    @Column(name = "email", length = 255)
    private String email;

    @Column(name = "phone", length = 50)
    private String phone;

    @Column(name = "has_primary", nullable = false)
    private boolean hasPrimary;

    @Column(name = "has_secondary", nullable = false)
    private boolean hasSecondary;

    @Column(name = "has_tertiary", nullable = false)
    private boolean hasTertiary;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    protected School() {
    }

    public School(String name, String subdomain) {
        this.name = name;
        this.subdomain = subdomain;
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSubdomain() {
        return subdomain;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public boolean isHasPrimary() {
        return hasPrimary;
    }

    public boolean isHasSecondary() {
        return hasSecondary;
    }

    public boolean isHasTertiary() {
        return hasTertiary;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    /**
     * True when at least one requested flag differs from the stored value.
     */
    public boolean differsFrom(SchoolLevels levels) {
        if (levels == null) {
            return false;
        }
        return (levels.primary() != null && levels.primary() != hasPrimary)
                || (levels.secondary() != null && levels.secondary() != hasSecondary)
                || (levels.tertiary() != null && levels.tertiary() != hasTertiary);
    }

    public void applyLevels(SchoolLevels levels) {
        if (levels == null) {
            return;
        }
        if (levels.primary() != null) {
            hasPrimary = levels.primary();
        }
        if (levels.secondary() != null) {
            hasSecondary = levels.secondary();
        }
        if (levels.tertiary() != null) {
            hasTertiary = levels.tertiary();
        }
    }

    public SchoolLevels levels() {
        return new SchoolLevels(hasPrimary, hasSecondary, hasTertiary);
    }
}
