package org.javai.declarative.exec;

/**
 * Thrown when a protected resource refuses a mutating operation.
 */
public class ProtectionViolationException extends ChangeExecutionException {

	public ProtectionViolationException(String message) {
		super(ErrorKind.PROTECTION, message);
	}

	public ProtectionViolationException(String message, Throwable cause) {
		super(ErrorKind.PROTECTION, message, cause);
	}
}
