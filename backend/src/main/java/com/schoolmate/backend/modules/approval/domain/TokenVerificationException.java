package com.schoolmate.backend.modules.approval.domain;

import com.schoolmate.backend.global.error.ProblemException;
import com.schoolmate.backend.global.error.ProblemKind;

public class TokenVerificationException extends ProblemException {

    public static final String CODE = "approval.verification_failed";

    private final TokenRejection rejection;

    public TokenVerificationException(TokenRejection rejection) {
        super(ProblemKind.VERIFICATION_FAILED, CODE, "Verification failed. Request a new token and try again.");
        this.rejection = rejection;
    }

    public TokenRejection getRejection() {
        return rejection;
    }
}
