package com.keyregistry.groups.exception;

/**
 * Exception thrown when a derived record address holds no record.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
