package com.lendora.lending.exception;

/**
 * Exception thrown when an operation requires an active loan
 */
public class LoanNotActiveException extends LendingException {

    public LoanNotActiveException(String message) {
        super(ErrorCategory.BUSINESS_RULE, "LOAN_NOT_ACTIVE", message);
    }

    public LoanNotActiveException(String message, Throwable cause) {
        super(ErrorCategory.BUSINESS_RULE, "LOAN_NOT_ACTIVE", message, cause);
    }
}
