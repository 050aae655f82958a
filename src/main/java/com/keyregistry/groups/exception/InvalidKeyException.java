package com.keyregistry.groups.exception;

/**
 * Exception thrown when a record address cannot be derived or verified.
 * Used by RegistryKeyFactory to keep every key a pure function of valid logical inputs.
 */
public class InvalidKeyException extends RuntimeException {
    
    public InvalidKeyException(String message) {
        super(message);
    }
    
    public InvalidKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
