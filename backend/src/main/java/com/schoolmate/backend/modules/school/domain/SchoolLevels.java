package com.schoolmate.backend.modules.school.domain;

/**
 * Requested education levels. A {@code null} flag means "leave unchanged".
 */
public record SchoolLevels(Boolean primary, Boolean secondary, Boolean tertiary) {

    public boolean specifiesNothing() {
        return primary == null && secondary == null && tertiary == null;
    }
}
