package org.javai.declarative.exec.resource;

import java.util.List;
import java.util.function.Supplier;
import org.javai.declarative.exec.ChangeExecutionException;
import org.javai.declarative.exec.ChangeValidationException;
import org.javai.declarative.exec.ResourceApiException;
import org.javai.declarative.plan.PlannedChange;
import org.javai.declarative.state.ApiClientException;

/**
 * Checks shared by the base executors.
 */
final class ResourceChecks {

	private ResourceChecks() {
	}

	static String dryRunId(String resourceType) {
		return "dry-run-" + resourceType + "-id";
	}

	static void validateRequiredFields(String resourceType, PlannedChange change, List<String> requiredFields) {
		for (String field : requiredFields) {
			if (!change.fields().containsKey(field) || change.fields().get(field) == null) {
				throw new ChangeValidationException(
						"required field '%s' is missing for %s".formatted(field, resourceType));
			}
			if (change.fields().get(field) instanceof String text && text.isEmpty()) {
				throw new ChangeValidationException(
						"required field '%s' cannot be empty for %s".formatted(field, resourceType));
			}
		}
	}

	/**
	 * Run a remote call, wrapping anything but a change-level error with operation and resource context.
	 */
	static <T> T call(String operation, String resourceType, String resourceName, Supplier<T> call) {
		try {
			return call.get();
		} catch (ChangeExecutionException e) {
			throw e;
		} catch (RuntimeException e) {
			throw ResourceApiException.during(operation, resourceType, resourceName, e);
		}
	}

	/**
	 * Whether a wrapped remote failure was the API answering "not found".
	 */
	static boolean isNotFound(ResourceApiException e) {
		return e.getCause() instanceof ApiClientException apiError && apiError.isNotFound();
	}

	static void run(String operation, String resourceType, String resourceName, Runnable call) {
		call(operation, resourceType, resourceName, () -> {
			call.run();
			return null;
		});
	}
}
