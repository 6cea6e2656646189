package com.poc.vmmigration.exception;

/**
 * Exception thrown when the backing object store cannot be read or written.
 */
public class StorageException extends MigrationException {
    
    public StorageException(String message) {
        super(message);
    }
    
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
