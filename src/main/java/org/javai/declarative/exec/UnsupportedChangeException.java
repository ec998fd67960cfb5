package org.javai.declarative.exec;

/**
 * Thrown when no executor handles a resource type and action.
 */
public class UnsupportedChangeException extends ChangeExecutionException {

	public UnsupportedChangeException(String message) {
		super(ErrorKind.NOT_IMPLEMENTED, message);
	}

	public UnsupportedChangeException(String message, Throwable cause) {
		super(ErrorKind.NOT_IMPLEMENTED, message, cause);
	}
}
