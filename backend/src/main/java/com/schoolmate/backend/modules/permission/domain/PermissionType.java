package com.schoolmate.backend.modules.permission.domain;

/**
 * Action level on a resource, ordered READ &lt; WRITE &lt; ADMIN. ADMIN subsumes the other two.
 */
public enum PermissionType {
    READ("Read"),
    WRITE("Write"),
    ADMIN("Admin");

    private final String label;

    PermissionType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
