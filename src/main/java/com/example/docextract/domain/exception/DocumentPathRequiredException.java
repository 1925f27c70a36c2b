package com.example.docextract.domain.exception;

/**
 * Raised when a caller attempts to load a document from a null {@link java.nio.file.Path}.
 */
public class DocumentPathRequiredException extends DomainException {

    public DocumentPathRequiredException() {
        super("Document path is required.");
    }
}
