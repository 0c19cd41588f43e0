package com.schoolmate.backend.global.security;

import java.io.IOException;

import com.schoolmate.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Writes the 401 problem body for requests that reach an authenticated route without a usable
 * access token. A rejected bearer token and a missing one get different codes so the dashboard can
 * decide between refreshing the session and sending the user to sign in.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    public static final String TOKEN_REQUIRED = "auth.token_required";
    public static final String TOKEN_INVALID = "auth.token_invalid";

    private static final Logger log = LoggerFactory.getLogger(RestAuthenticationEntryPoint.class);
    private static final String REALM = "Bearer realm=\"schoolmate\"";

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        boolean rejectedToken = authException instanceof BadCredentialsException;
        ProblemResponse body = rejectedToken
                ? ProblemResponse.of(HttpStatus.UNAUTHORIZED, TOKEN_INVALID,
                        "The access token is invalid or has expired.", request.getRequestURI())
                : ProblemResponse.of(HttpStatus.UNAUTHORIZED, TOKEN_REQUIRED,
                        "Sign in to access school administration.", request.getRequestURI());
        if (rejectedToken) {
            log.debug("Rejected access token on {} {}: {}", request.getMethod(), request.getRequestURI(),
                    authException.getMessage());
        }

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE,
                rejectedToken ? REALM + ", error=\"invalid_token\"" : REALM);
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
