package com.example.docextract.application.exception;

/**
 * Signals validation issues detected while running an application layer use case,
 * for example a batch run without any input documents.
 */
public class UseCaseValidationException extends ApplicationException {

	/**
	 * Builds an exception containing a validation message that can be propagated to the caller.
	 *
	 * @param message specific validation failure
	 */
    public UseCaseValidationException(String message) {
        super(message);
    }
}
