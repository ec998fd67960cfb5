package org.javai.declarative.state;

/**
 * Failure reported by a {@link StateClient} call.
 */
public class ApiClientException extends RuntimeException {

	private final int statusCode;

	public ApiClientException(String message) {
		this(message, 0, null);
	}

	public ApiClientException(String message, int statusCode) {
		this(message, statusCode, null);
	}

	public ApiClientException(String message, int statusCode, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
	}

	/**
	 * HTTP status of the failed call, or 0 when no response was received.
	 */
	public int statusCode() {
		return statusCode;
	}

	public boolean isNotFound() {
		return statusCode == 404;
	}
}
