package com.poc.vmmigration.exception;

/**
 * Exception thrown when an operation is not allowed in the object's current state,
 * e.g. reassigning a workload IP or re-running a running migration.
 */
public class InvalidStateException extends MigrationException {
    
    public InvalidStateException(String message) {
        super(message);
    }
    
    public InvalidStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
