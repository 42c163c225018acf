package com.chronofill.backend.exception;

/**
 * Raised when a backfill request cannot be accepted. Each subtype carries a stable machine-readable code.
 */
public class BackfillValidationException extends RuntimeException {

    private final String errorCode;

    public BackfillValidationException(String message) {
        this("VALIDATION_ERROR", message);
    }

    protected BackfillValidationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
