package com.schoolmate.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/**
 * Caller network metadata recorded on audit entries and approval tokens.
 */
public record ClientRequestInfo(String ipAddress, String userAgent) {

    public static final String UNKNOWN = "unknown";
    private static final String X_FORWARDED_FOR = "X-Forwarded-For";
    private static final int MAX_USER_AGENT_LENGTH = 500;

    public ClientRequestInfo {
        ipAddress = StringUtils.hasText(ipAddress) ? ipAddress.trim() : UNKNOWN;
        userAgent = StringUtils.hasText(userAgent) ? truncate(userAgent.trim()) : UNKNOWN;
    }

    public static ClientRequestInfo from(HttpServletRequest request) {
        // The first X-Forwarded-For entry is the original client when behind the ingress proxy
        String forwardedFor = request.getHeader(X_FORWARDED_FOR);
        String ip = StringUtils.hasText(forwardedFor)
                ? forwardedFor.split(",")[0].trim()
                : request.getRemoteAddr();
        return new ClientRequestInfo(ip, request.getHeader(HttpHeaders.USER_AGENT));
    }

    public static ClientRequestInfo unknown() {
        return new ClientRequestInfo(null, null);
    }

    private static String truncate(String value) {
        return value.length() > MAX_USER_AGENT_LENGTH ? value.substring(0, MAX_USER_AGENT_LENGTH) : value;
    }
}
