package com.schoolmate.backend.modules.tenant.presentation;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

import com.schoolmate.backend.global.error.ProblemException;
import com.schoolmate.backend.modules.tenant.domain.TenantHint;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.util.StringUtils;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Reads the tenant hint from a request: {@code {schoolId}} path variable, then the
 * {@code X-Tenant-Id} header, then the school label of a {@code <school>.<base-domain>} host.
 * Without a configured base domain, host names are never read as tenant hints.
 */
public final class TenantHintExtractor {

    public static final String TENANT_HEADER = "X-Tenant-Id";
    static final String SCHOOL_ID_VARIABLE = "schoolId";

    private static final Set<String> RESERVED_LABELS = Set.of("www", "api", "app", "admin");
    private static final Pattern SUBDOMAIN = Pattern.compile("^[a-z0-9]([a-z0-9-]{0,61}[a-z0-9])?$");

    private TenantHintExtractor() {
    }

    public static TenantHint extract(HttpServletRequest request, String baseDomain) {
        String pathValue = pathVariable(request);
        if (StringUtils.hasText(pathValue)) {
            return TenantHint.ofSchoolId(parse(pathValue));
        }
        String header = request.getHeader(TENANT_HEADER);
        if (StringUtils.hasText(header)) {
            return TenantHint.ofSchoolId(parse(header.trim()));
        }
        String subdomain = subdomainOf(request.getServerName(), baseDomain);
        return subdomain != null ? TenantHint.ofSubdomain(subdomain) : TenantHint.none();
    }

    static String subdomainOf(String host, String baseDomain) {
        if (!StringUtils.hasText(host) || !StringUtils.hasText(baseDomain)) {
            return null;
        }
        String normalizedHost = host.trim().toLowerCase();
        String suffix = "." + trimDots(baseDomain.trim().toLowerCase());
        if (!normalizedHost.endsWith(suffix)) {
            return null;
        }
        String label = normalizedHost.substring(0, normalizedHost.length() - suffix.length());
        if (label.contains(".") || RESERVED_LABELS.contains(label)) {
            return null;
        }
        return SUBDOMAIN.matcher(label).matches() ? label : null;
    }

    private static String trimDots(String domain) {
        int start = 0;
        int end = domain.length();
        while (start < end && domain.charAt(start) == '.') {
            start++;
        }
        while (end > start && domain.charAt(end - 1) == '.') {
            end--;
        }
        return domain.substring(start, end);
    }

    @SuppressWarnings("unchecked")
    private static String pathVariable(HttpServletRequest request) {
        Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (attribute instanceof Map<?, ?> variables) {
            return ((Map<String, String>) variables).get(SCHOOL_ID_VARIABLE);
        }
        return null;
    }

    private static UUID parse(String value) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.invalidInput("tenant.invalid_hint", "School id must be a UUID");
        }
    }
}
