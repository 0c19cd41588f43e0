package com.schoolmate.backend.modules.tenant.domain;

import java.util.UUID;

/**
 * Optional pointers to a target school carried by a request. An explicit id (path variable or
 * header) takes precedence over a host subdomain.
 */
public record TenantHint(UUID schoolId, String subdomain) {

    private static final TenantHint NONE = new TenantHint(null, null);

    public static TenantHint none() {
        return NONE;
    }

    public static TenantHint ofSchoolId(UUID schoolId) {
        return new TenantHint(schoolId, null);
    }

    public static TenantHint ofSubdomain(String subdomain) {
        return new TenantHint(null, subdomain);
    }

    public boolean isEmpty() {
        return schoolId == null && (subdomain == null || subdomain.isBlank());
    }
}
