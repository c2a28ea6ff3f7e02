package com.lendora.lending.exception;

/**
 * Exception thrown when no price inside the freshness window is available for an asset
 */
public class StalePriceException extends LendingException {

    public StalePriceException(String message) {
        super(ErrorCategory.DEPENDENCY_UNAVAILABLE, "STALE_PRICE", message);
    }

    public StalePriceException(String message, Throwable cause) {
        super(ErrorCategory.DEPENDENCY_UNAVAILABLE, "STALE_PRICE", message, cause);
    }
}
