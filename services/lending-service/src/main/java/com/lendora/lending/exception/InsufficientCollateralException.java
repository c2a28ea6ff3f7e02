package com.lendora.lending.exception;

/**
 * Exception thrown when collateral does not cover the requested operation
 */
public class InsufficientCollateralException extends LendingException {

    public InsufficientCollateralException(String message) {
        super(ErrorCategory.BUSINESS_RULE, "INSUFFICIENT_COLLATERAL", message);
    }

    public InsufficientCollateralException(String message, Throwable cause) {
        super(ErrorCategory.BUSINESS_RULE, "INSUFFICIENT_COLLATERAL", message, cause);
    }
}
