package org.javai.declarative.labels;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.declarative.exec.ProtectionViolationException;
import org.javai.declarative.plan.ActionType;
import org.javai.declarative.plan.Fields;
import org.javai.declarative.plan.Protection;

/**
 * Decides whether a mutating operation may touch a protected resource.
 * <p>
 * A protected resource accepts only a change that carries an explicit protection
 * transition, and that change may not alter anything besides protection.
 */
public final class ProtectionPolicy {

	private ProtectionPolicy() {
	}

	public static boolean isProtectionChange(Protection protection) {
		return protection != null && protection.isTransition();
	}

	/**
	 * @throws ProtectionViolationException when the resource is protected and the change
	 * is not a protection transition
	 */
	public static void validate(String resourceType, String resourceName, boolean isProtected, ActionType action,
			boolean isProtectionChange) {
		if (isProtected && !isProtectionChange) {
			throw new ProtectionViolationException(
					"resource '%s' (%s) is protected and cannot be %s".formatted(
							resourceName, resourceType, pastTense(action)));
		}
	}

	/**
	 * Reject a protection transition on a protected resource that also changes other fields.
	 * The {@code name} field, label fields and internal keys (leading underscore) are ignored.
	 */
	public static void validateTransitionOnly(String resourceType, String resourceName, Map<String, Object> fields) {
		List<String> others = new ArrayList<>();
		if (fields != null) {
			for (String key : fields.keySet()) {
				if (!Fields.NAME.equals(key) && !Fields.LABELS.equals(key) && !key.startsWith("_")) {
					others.add(key);
				}
			}
		}
		if (!others.isEmpty()) {
			throw new ProtectionViolationException(
					"resource '%s' (%s) is protected; a protection change cannot be combined with changes to %s"
							.formatted(resourceName, resourceType, others));
		}
	}

	private static String pastTense(ActionType action) {
		return switch (action) {
			case CREATE -> "created";
			case UPDATE -> "updated";
			case DELETE -> "deleted";
			case EXTERNAL_TOOL -> "modified";
		};
	}
}
