package com.lendora.lending.exception;

/**
 * Checked failure of a bounded call to an external collaborator. Callers translate it into the
 * dependency error of their own contract.
 */
public class ExternalCallFailedException extends Exception {

    private final boolean timedOut;

    public ExternalCallFailedException(String message, Throwable cause, boolean timedOut) {
        super(message, cause);
        this.timedOut = timedOut;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
