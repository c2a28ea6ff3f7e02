package com.lendora.lending.exception;

/**
 * Exception thrown when a non-administrator changes protocol parameters
 */
public class UnauthorizedParameterChangeException extends LendingException {

    public UnauthorizedParameterChangeException(String message) {
        super(ErrorCategory.BUSINESS_RULE, "UNAUTHORIZED_PARAMETER_CHANGE", message);
    }

    public UnauthorizedParameterChangeException(String message, Throwable cause) {
        super(ErrorCategory.BUSINESS_RULE, "UNAUTHORIZED_PARAMETER_CHANGE", message, cause);
    }
}
