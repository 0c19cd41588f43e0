package com.schoolmate.backend.modules.school.presentation.dto;

import com.schoolmate.backend.modules.school.domain.SchoolProfileChanges;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record UpdateSchoolProfileRequest(
        @Size(max = 200) String name,
        @Size(max = 500) String address,
        @Email @Size(max = 255) String email,
        @Size(max = 50) String phone,
        String subdomain,
        Boolean active,
        SchoolLevelsPayload levels
) {

    public SchoolProfileChanges toChanges() {
        return new SchoolProfileChanges(
                name,
                address,
                email,
                phone,
                subdomain,
                active,
                levels != null ? levels.toLevels() : null
        );
    }
}
