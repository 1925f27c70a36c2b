package com.example.docextract.infrastructure.exception;

/**
 * Base unchecked exception for adapter failures: PDFBox or POI parsing, upload staging and storage.
 * Always carries the library exception that caused it.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * @param message which document or artifact was being handled
	 * @param cause   exception raised by the underlying library or the filesystem
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
