package com.example.docextract.domain.exception;

/**
 * Raised when an upload arrives without a file or with an empty one.
 */
public class DocumentFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public DocumentFileRequiredException() {
        super("Please choose a PDF, DOCX or PPTX file to upload.");
    }
}
