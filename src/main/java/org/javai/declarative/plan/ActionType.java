package org.javai.declarative.plan;

import java.util.Locale;

/**
 * The kind of operation a {@link PlannedChange} performs.
 */
public enum ActionType {
	CREATE("Creating", "create"),
	UPDATE("Updating", "update"),
	DELETE("Deleting", "delete"),
	EXTERNAL_TOOL("Running", "run");

	private final String progressVerb;
	private final String operation;

	ActionType(String progressVerb, String operation) {
		this.progressVerb = progressVerb;
		this.operation = operation;
	}

	/**
	 * Verb used in progress output, e.g. "Creating".
	 */
	public String progressVerb() {
		return progressVerb;
	}

	/**
	 * Lower-case operation name used in error messages, e.g. "create".
	 */
	public String operation() {
		return operation;
	}

	/**
	 * Parse the wire form ("CREATE", "create") of an action.
	 */
	public static ActionType parse(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("action must not be blank");
		}
		return ActionType.valueOf(value.trim().toUpperCase(Locale.ROOT));
	}
}
