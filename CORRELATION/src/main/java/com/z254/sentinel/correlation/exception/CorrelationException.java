package com.z254.sentinel.correlation.exception;

/**
 * Base exception for correlation engine failures.
 */
public class CorrelationException extends RuntimeException {

    private final String errorCode;

    public CorrelationException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public CorrelationException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
