package com.lendora.lending.exception;

/**
 * Distinguishes caller mistakes from system unavailability.
 */
public enum ErrorCategory {

    /** Bad input, rejected before any state change. */
    VALIDATION(false),

    /** Business rule rejection; loan state unchanged, caller retries with corrected input. */
    BUSINESS_RULE(false),

    /** A collaborator (price feed, credit verifier) could not answer; fails closed. */
    DEPENDENCY_UNAVAILABLE(true),

    /** Lost the race for a loan or position; nothing was applied. */
    CONCURRENCY_CONFLICT(true);

    private final boolean retryable;

    ErrorCategory(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
