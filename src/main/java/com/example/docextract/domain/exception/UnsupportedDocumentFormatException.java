package com.example.docextract.domain.exception;

/**
 * Raised when a file's extension does not map to a supported document format.
 */
public class UnsupportedDocumentFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName file name supplied by the caller
	 */
    public UnsupportedDocumentFormatException(String fileName) {
        super("Only PDF, DOCX and PPTX documents are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
