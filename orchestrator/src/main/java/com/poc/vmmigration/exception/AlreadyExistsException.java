package com.poc.vmmigration.exception;

/**
 * Exception thrown when an object is already stored under the key being created.
 */
public class AlreadyExistsException extends MigrationException {
    
    public AlreadyExistsException(String message) {
        super(message);
    }
    
    public AlreadyExistsException(String message, Throwable cause) {
        super(message, cause);
    }
}
