package com.schoolmate.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Client-visible failure classes. Each kind maps to one HTTP status so the dashboard can tell
 * "no access" apart from "does not exist" and "bad input".
 */
public enum ProblemKind {

    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    TENANT_REQUIRED(HttpStatus.FORBIDDEN),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_OPERATION(HttpStatus.CONFLICT),
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    VERIFICATION_FAILED(HttpStatus.BAD_REQUEST),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS);

    private final HttpStatus status;

    ProblemKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
