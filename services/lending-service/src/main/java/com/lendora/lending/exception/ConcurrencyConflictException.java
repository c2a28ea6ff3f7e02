package com.lendora.lending.exception;

/**
 * Exception thrown when a loan or collateral position is held by a concurrent operation
 */
public class ConcurrencyConflictException extends LendingException {

    public ConcurrencyConflictException(String message) {
        super(ErrorCategory.CONCURRENCY_CONFLICT, "CONCURRENCY_CONFLICT", message);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(ErrorCategory.CONCURRENCY_CONFLICT, "CONCURRENCY_CONFLICT", message, cause);
    }
}
