package com.schoolmate.backend.modules.school.domain;

/**
 * Partial update of a school profile. {@code null} fields are left unchanged.
 * {@code subdomain} and {@code active} are platform-managed and refused when present.
 */
public record SchoolProfileChanges(
        String name,
        String address,
        String email,
        String phone,
        String subdomain,
        Boolean active,
        SchoolLevels levels
) {

    public boolean touchesRestrictedFields() {
        return subdomain != null || active != null;
    }

    public boolean hasBasicChanges() {
        return name != null || address != null || email != null || phone != null;
    }

    public SchoolProfileChanges withoutLevels() {
        return new SchoolProfileChanges(name, address, email, phone, subdomain, active, null);
    }

    public static SchoolProfileChanges levelsOnly(SchoolLevels levels) {
        return new SchoolProfileChanges(null, null, null, null, null, null, levels);
    }
}
