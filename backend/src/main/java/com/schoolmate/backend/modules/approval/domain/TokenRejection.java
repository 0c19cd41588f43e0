package com.schoolmate.backend.modules.approval.domain;

/**
 * Internal reason a verification was refused. Callers only ever see a generic failure.
 */
public enum TokenRejection {
    INVALID_TOKEN,
    TOKEN_EXPIRED,
    TOKEN_ALREADY_USED,
    ACTOR_MISMATCH
}
