package com.lendora.lending.exception;

/**
 * Exception thrown when an amount is zero, negative or not a whole number of smallest units
 */
public class InvalidAmountException extends ValidationException {

    public InvalidAmountException(String message) {
        super("INVALID_AMOUNT", message);
    }
}
