package org.javai.declarative.exec;

/**
 * Thrown when a change is malformed, before any network call is made.
 */
public class ChangeValidationException extends ChangeExecutionException {

	public ChangeValidationException(String message) {
		super(ErrorKind.VALIDATION, message);
	}

	public ChangeValidationException(String message, Throwable cause) {
		super(ErrorKind.VALIDATION, message, cause);
	}
}
