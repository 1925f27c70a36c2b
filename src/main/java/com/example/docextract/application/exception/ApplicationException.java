package com.example.docextract.application.exception;

/**
 * Base unchecked exception for use-case failures such as an empty batch request.
 * Mapped to a 4xx response by the API layer and to a non-zero exit code by the batch runner.
 */
public abstract class ApplicationException extends RuntimeException {

	/**
	 * @param message description of the rejected request, shown to the caller as is
	 */
    protected ApplicationException(String message) {
        super(message);
    }
}
