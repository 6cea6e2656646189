package com.poc.vmmigration.exception;

/**
 * Exception thrown when a field is missing or malformed, an enum value is unknown,
 * or the boot volume rule is violated.
 */
public class InvalidArgumentException extends MigrationException {
    
    public InvalidArgumentException(String message) {
        super(message);
    }
    
    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
