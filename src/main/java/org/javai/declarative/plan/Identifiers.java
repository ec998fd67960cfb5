package org.javai.declarative.plan;

import java.util.regex.Pattern;

/**
 * Helpers for telling concrete remote identifiers apart from names and placeholders.
 */
public final class Identifiers {

	/**
	 * Marker used by the planner when a name or id could not be determined.
	 */
	public static final String UNKNOWN = "[unknown]";

	private static final Pattern UUID = Pattern.compile(
			"^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

	private Identifiers() {
	}

	/**
	 * Whether the value has the strict identifier format used by the remote API.
	 */
	public static boolean isUuid(String value) {
		return value != null && UUID.matcher(value).matches();
	}

	/**
	 * Whether the value can be handed to the remote API as an identifier.
	 * Blank values, {@link #UNKNOWN} and {@code __REF__} placeholders are not concrete.
	 */
	public static boolean isConcrete(String value) {
		return value != null
				&& !value.isBlank()
				&& !UNKNOWN.equals(value)
				&& !RefPlaceholder.isPlaceholder(value);
	}
}
