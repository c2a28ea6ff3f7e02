package com.lendora.lending.exception;

/**
 * Exception thrown when a withdrawal would leave an active loan under the minimum collateral ratio
 */
public class BelowMinimumRatioException extends LendingException {

    public BelowMinimumRatioException(String message) {
        super(ErrorCategory.BUSINESS_RULE, "BELOW_MINIMUM_RATIO", message);
    }

    public BelowMinimumRatioException(String message, Throwable cause) {
        super(ErrorCategory.BUSINESS_RULE, "BELOW_MINIMUM_RATIO", message, cause);
    }
}
