package org.javai.declarative.exec;

/**
 * Thrown when an identifier a change depends on cannot be resolved.
 */
public class ReferenceResolutionException extends ChangeExecutionException {

	public ReferenceResolutionException(String message) {
		super(ErrorKind.REFERENCE, message);
	}

	public ReferenceResolutionException(String message, Throwable cause) {
		super(ErrorKind.REFERENCE, message, cause);
	}
}
