package com.arrangement.core.exception;

/**
 * Base exception for all arrangement errors.
 */
public class ArrangementException extends RuntimeException {

    private final String errorCode;

    public ArrangementException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ArrangementException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether the caller may reasonably retry against fresher state.
     */
    public boolean isRetryable() {
        return false;
    }
}
