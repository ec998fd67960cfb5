package org.javai.declarative.plan;

import java.util.Locale;

/**
 * How the planner compared desired and current state.
 * APPLY - only creates and updates are planned.
 * SYNC  - deletes of unmanaged-in-config resources are planned as well.
 */
public enum PlanMode {
	APPLY,
	SYNC;

	public String value() {
		return name().toLowerCase(Locale.ROOT);
	}

	public static PlanMode parse(String value) {
		if (value == null || value.isBlank()) {
			return APPLY;
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		for (PlanMode mode : values()) {
			if (mode.value().equals(normalized)) {
				return mode;
			}
		}
		throw new IllegalArgumentException("unsupported plan mode: " + value);
	}
}
