package com.schoolmate.backend.global.error;

import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:schoolmate:";

    private final ProblemKind kind;
    private final String code;
    private final String detail;
    private final String type;

    public ProblemException(ProblemKind kind, String code) {
        this(kind, code, null);
    }

    public ProblemException(ProblemKind kind, String code, String detail) {
        super(kind.status(), code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.kind = kind;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
    }

    public static ProblemException unauthenticated(String detail) {
        return new ProblemException(ProblemKind.UNAUTHENTICATED, "auth.token_required", detail);
    }

    public static ProblemException tenantRequired(String detail) {
        return new ProblemException(ProblemKind.TENANT_REQUIRED, "tenant.required", detail);
    }

    public static ProblemException forbidden(String code, String detail) {
        return new ProblemException(ProblemKind.FORBIDDEN, code, detail);
    }

    public static ProblemException notFound(String code, String detail) {
        return new ProblemException(ProblemKind.NOT_FOUND, code, detail);
    }

    public static ProblemException invalidOperation(String code, String detail) {
        return new ProblemException(ProblemKind.INVALID_OPERATION, code, detail);
    }

    public static ProblemException invalidInput(String code, String detail) {
        return new ProblemException(ProblemKind.INVALID_INPUT, code, detail);
    }

    public ProblemKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }
}
