package com.keyregistry.groups.exception;

/**
 * Exception thrown when a registry transaction is cancelled for a reason other than
 * a failed condition (throttling, conflicting in-flight transaction, validation by the store).
 * No write of the transaction has been applied.
 */
public class TransactionFailedException extends RuntimeException {
    
    public TransactionFailedException(String message) {
        super(message);
    }
    
    public TransactionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
