package com.schoolmate.backend.modules.staff.presentation.dto;

import java.util.UUID;

import com.schoolmate.backend.modules.staff.domain.SchoolAdmin;

public record SchoolAdminResponse(
        UUID id,
        UUID schoolId,
        UUID userId,
        String firstName,
        String lastName,
        String email,
        String role,
        boolean fullAccess,
        UUID registeredBy
) {

    public static SchoolAdminResponse from(SchoolAdmin admin) {
        return new SchoolAdminResponse(
                admin.getId(),
                admin.getSchoolId(),
                admin.getUserId(),
                admin.getFirstName(),
                admin.getLastName(),
                admin.getEmail(),
                admin.getRole(),
                admin.isFullAccess(),
                admin.getCreatedBy()
        );
    }
}
