package com.lendora.lending.exception;

/**
 * Exception thrown when a repayment exceeds the outstanding balance
 */
public class OverRepaymentException extends LendingException {

    public OverRepaymentException(String message) {
        super(ErrorCategory.BUSINESS_RULE, "OVER_REPAYMENT", message);
    }

    public OverRepaymentException(String message, Throwable cause) {
        super(ErrorCategory.BUSINESS_RULE, "OVER_REPAYMENT", message, cause);
    }
}
