package com.keyregistry.groups.exception;

/**
 * Exception thrown when an input field fails a shape check.
 * Raised before any storage access.
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
