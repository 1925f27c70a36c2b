package com.example.docextract.infrastructure.exception;

/**
 * Raised when artifacts cannot be written: missing permissions, full disk, or a failed statement.
 */
public class StorageWriteException extends StorageException {

    public StorageWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
