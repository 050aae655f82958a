package com.keyregistry.groups.exception;

/**
 * Exception thrown when a request carries no authenticated caller identity.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
