package org.javai.declarative.exec;

/**
 * Thrown when the external subprocess step cannot be prepared or fails.
 */
public class ExternalToolException extends ChangeExecutionException {

	public ExternalToolException(String message) {
		super(ErrorKind.EXTERNAL_TOOL, message);
	}

	public ExternalToolException(String message, Throwable cause) {
		super(ErrorKind.EXTERNAL_TOOL, message, cause);
	}
}
