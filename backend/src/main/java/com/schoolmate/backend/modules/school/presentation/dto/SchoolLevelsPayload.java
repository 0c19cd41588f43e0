package com.schoolmate.backend.modules.school.presentation.dto;

import com.schoolmate.backend.modules.school.domain.SchoolLevels;

public record SchoolLevelsPayload(Boolean primary, Boolean secondary, Boolean tertiary) {

    public SchoolLevels toLevels() {
        return new SchoolLevels(primary, secondary, tertiary);
    }
}
