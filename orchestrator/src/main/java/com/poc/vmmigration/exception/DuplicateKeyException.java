package com.poc.vmmigration.exception;

/**
 * Exception thrown when a workload is registered with an IP that another
 * workload already uses. Kept apart from {@link AlreadyExistsException}
 * because IP uniqueness is a domain rule, not a store collision.
 */
public class DuplicateKeyException extends MigrationException {
    
    public DuplicateKeyException(String message) {
        super(message);
    }
}
