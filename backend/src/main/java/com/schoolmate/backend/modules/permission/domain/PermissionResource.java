package com.schoolmate.backend.modules.permission.domain;

/**
 * Protected areas of a school workspace. Names are persisted, so constants may be added but never
 * renamed or reordered away from their stored values.
 */
public enum PermissionResource {
    OVERVIEW("Dashboard Overview"),
    ANALYTICS("Analytics"),
    SUBSCRIPTIONS("Subscriptions"),
    STUDENTS("Students"),
    STAFF("Staff"),
    CLASSES("Classes"),
    SUBJECTS("Subjects"),
    TIMETABLES("Timetables"),
    CALENDAR("Calendar"),
    ADMISSIONS("Admissions"),
    SESSIONS("Sessions"),
    EVENTS("Events"),
    GRADES("Grades"),
    CURRICULUM("Curriculum"),
    RESOURCES("Class Resources"),
    TRANSFERS("Student Transfers"),
    INTEGRATIONS("External Integrations");

    private final String displayName;

    PermissionResource(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
