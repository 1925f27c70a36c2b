package com.example.docextract.infrastructure.exception;

/**
 * Raised when the database rejects a row because of a constraint violation.
 */
public class StorageIntegrityException extends StorageException {

    public StorageIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
