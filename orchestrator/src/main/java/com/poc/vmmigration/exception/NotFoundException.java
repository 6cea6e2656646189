package com.poc.vmmigration.exception;

/**
 * Exception thrown when no object is stored under the requested key.
 */
public class NotFoundException extends MigrationException {
    
    public NotFoundException(String message) {
        super(message);
    }
    
    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
