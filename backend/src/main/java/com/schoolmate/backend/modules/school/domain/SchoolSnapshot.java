package com.schoolmate.backend.modules.school.domain;

import java.util.UUID;

public record SchoolSnapshot(
        UUID id,
        String name,
        String subdomain,
        String address,
        String email,
        String phone,
        SchoolLevels levels,
        boolean active
) {

    public static SchoolSnapshot of(School school) {
        return new SchoolSnapshot(
                school.getId(),
                school.getName(),
                school.getSubdomain(),
                school.getAddress(),
                school.getEmail(),
                school.getPhone(),
                school.levels(),
                school.isActive()
        );
    }
}
