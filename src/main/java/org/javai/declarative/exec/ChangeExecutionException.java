package org.javai.declarative.exec;

import java.util.Objects;

/**
 * Base class of all errors that fail a single change.
 * <p>
 * The executor catches these per change, records them in the
 * {@link ExecutionResult} and moves on to the next change.
 */
public class ChangeExecutionException extends RuntimeException {

	private final ErrorKind kind;

	public ChangeExecutionException(ErrorKind kind, String message) {
		super(message);
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
	}

	public ChangeExecutionException(ErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
	}

	public ErrorKind kind() {
		return kind;
	}
}
