package com.lendora.lending.exception;

/**
 * Exception thrown when a loan does not exist
 */
public class LoanNotFoundException extends LendingException {

    public LoanNotFoundException(String message) {
        super(ErrorCategory.BUSINESS_RULE, "LOAN_NOT_FOUND", message);
    }

    public LoanNotFoundException(String message, Throwable cause) {
        super(ErrorCategory.BUSINESS_RULE, "LOAN_NOT_FOUND", message, cause);
    }
}
