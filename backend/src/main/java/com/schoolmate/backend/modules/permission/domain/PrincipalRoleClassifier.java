package com.schoolmate.backend.modules.permission.domain;

import java.util.Locale;

/**
 * Decides, once at account creation, whether an administrator's display role makes them the
 * school's Principal.
 * <p>
 * The match is a case-insensitive substring test, so "Vice Principal" and "principal-assistant"
 * also classify as Principal. This mirrors current product behaviour and is intentionally left broad
 * until product owners confirm a narrower rule.
 */
public final class PrincipalRoleClassifier {

    private static final String PRINCIPAL_MARKER = "principal";

    private PrincipalRoleClassifier() {
    }

    public static boolean isPrincipal(String role) {
        if (role == null || role.isBlank()) {
            return false;
        }
        return role.toLowerCase(Locale.ROOT).contains(PRINCIPAL_MARKER);
    }
}
