package com.poc.vmmigration.exception;

/**
 * Exception thrown when the copy phase of a migration run fails.
 */
public class MigrationExecutionException extends MigrationException {
    
    public MigrationExecutionException(String message) {
        super(message);
    }
    
    public MigrationExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
