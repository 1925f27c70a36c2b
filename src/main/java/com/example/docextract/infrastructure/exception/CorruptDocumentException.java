package com.example.docextract.infrastructure.exception;

/**
 * Signals that PDFBox or POI could not parse a document. The file is abandoned as a whole.
 */
public class CorruptDocumentException extends InfrastructureException {

	/**
	 * Creates the exception with a contextual message and the root cause from the parsing library.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level library exception
	 */
    public CorruptDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
