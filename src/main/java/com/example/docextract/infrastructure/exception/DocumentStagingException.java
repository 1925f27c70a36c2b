package com.example.docextract.infrastructure.exception;

/**
 * Raised when an uploaded document cannot be copied to a temporary file for parsing.
 */
public class DocumentStagingException extends InfrastructureException {

    public DocumentStagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
