package com.example.docextract.infrastructure.exception;

/**
 * Raised when the database cannot be reached.
 */
public class StorageConnectionException extends StorageException {

    public StorageConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
