package com.lendora.lending.exception;

/**
 * Exception thrown for invalid input
 */
public class ValidationException extends LendingException {

    public ValidationException(String message) {
        super(ErrorCategory.VALIDATION, "VALIDATION_ERROR", message);
    }

    protected ValidationException(String errorCode, String message) {
        super(ErrorCategory.VALIDATION, errorCode, message);
    }
}
