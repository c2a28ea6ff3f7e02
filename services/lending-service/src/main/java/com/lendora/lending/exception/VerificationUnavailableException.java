package com.lendora.lending.exception;

/**
 * Exception thrown when a credit attestation cannot be checked
 */
public class VerificationUnavailableException extends LendingException {

    public VerificationUnavailableException(String message) {
        super(ErrorCategory.DEPENDENCY_UNAVAILABLE, "VERIFICATION_UNAVAILABLE", message);
    }

    public VerificationUnavailableException(String message, Throwable cause) {
        super(ErrorCategory.DEPENDENCY_UNAVAILABLE, "VERIFICATION_UNAVAILABLE", message, cause);
    }
}
