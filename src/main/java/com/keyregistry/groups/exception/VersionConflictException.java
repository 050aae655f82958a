package com.keyregistry.groups.exception;

/**
 * Exception thrown when a record changed between being read and being written.
 * The whole transaction was rejected; the caller decides whether to resubmit.
 */
public class VersionConflictException extends RuntimeException {

    public VersionConflictException(String message) {
        super(message);
    }

    public VersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
