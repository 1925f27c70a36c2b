package com.example.docextract.infrastructure.exception;

/**
 * Base type for failures while persisting an extraction result.
 */
public abstract class StorageException extends InfrastructureException {

    protected StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
