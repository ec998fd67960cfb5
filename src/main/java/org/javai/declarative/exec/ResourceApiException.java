package org.javai.declarative.exec;

/**
 * A remote API failure, wrapped with the operation, resource type and resource name.
 */
public class ResourceApiException extends ChangeExecutionException {

	public ResourceApiException(String message) {
		super(ErrorKind.API, message);
	}

	public ResourceApiException(String message, Throwable cause) {
		super(ErrorKind.API, message, cause);
	}

	/**
	 * Wrap a failure as {@code API error during <operation> of <type> '<name>': <cause>}.
	 */
	public static ResourceApiException during(String operation, String resourceType, String resourceName,
			Throwable cause) {
		return new ResourceApiException("API error during %s of %s '%s': %s".formatted(
				operation, resourceType, resourceName, cause.getMessage()), cause);
	}
}
