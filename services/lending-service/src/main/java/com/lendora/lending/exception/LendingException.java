package com.lendora.lending.exception;

import lombok.Getter;

/**
 * Base exception for the lending service
 */
@Getter
public class LendingException extends RuntimeException {

    private final ErrorCategory category;
    private final String errorCode;

    public LendingException(ErrorCategory category, String errorCode, String message) {
        super(message);
        this.category = category;
        this.errorCode = errorCode;
    }

    public LendingException(ErrorCategory category, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.errorCode = errorCode;
    }

    public boolean isRetryable() {
        return category.isRetryable();
    }
}
