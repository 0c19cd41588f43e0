package com.schoolmate.backend.global.error;

/**
 * Throttling failure carrying a retry-after hint in seconds.
 */
public class RetryableProblemException extends ProblemException {

    private final long retryAfterSeconds;

    public RetryableProblemException(String code, String detail, long retryAfterSeconds) {
        super(ProblemKind.RATE_LIMITED, code, detail);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
