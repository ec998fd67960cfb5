package org.javai.declarative.plan;

import java.util.Map;

/**
 * The protection requested by a change: either a plain desired state or an explicit
 * transition between two different states.
 */
public sealed interface Protection {

	/**
	 * The protection state the resource should have once the change is applied.
	 */
	boolean desired();

	/**
	 * Whether this value represents an explicit protection transition.
	 */
	default boolean isTransition() {
		return this instanceof Transition;
	}

	/**
	 * A desired protection state with no transition.
	 */
	record Flag(boolean value) implements Protection {
		@Override
		public boolean desired() {
			return value;
		}
	}

	/**
	 * An explicit protection transition. Only valid when the state actually changes.
	 */
	record Transition(boolean from, boolean to) implements Protection {
		public Transition {
			if (from == to) {
				throw new IllegalArgumentException("protection transition requires differing states, got " + from);
			}
		}

		@Override
		public boolean desired() {
			return to;
		}
	}

	static Protection flag(boolean value) {
		return new Flag(value);
	}

	static Protection transition(boolean from, boolean to) {
		return new Transition(from, to);
	}

	/**
	 * Convert a JSON-decoded protection value.
	 * Accepts {@code null}, a {@link Protection}, a {@link Boolean}, a string "true"/"false",
	 * or a map with boolean {@code old} and {@code new} entries. A map whose entries are
	 * equal collapses to a {@link Flag}.
	 *
	 * @return the protection, or {@code null} when the input is {@code null}
	 */
	static Protection of(Object raw) {
		if (raw == null) {
			return null;
		}
		if (raw instanceof Protection protection) {
			return protection;
		}
		if (raw instanceof Boolean value) {
			return new Flag(value);
		}
		if (raw instanceof String text && ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text))) {
			return new Flag(Boolean.parseBoolean(text));
		}
		if (raw instanceof Map<?, ?> map
				&& map.get("old") instanceof Boolean from
				&& map.get("new") instanceof Boolean to) {
			return from.equals(to) ? new Flag(to) : new Transition(from, to);
		}
		throw new IllegalArgumentException("unsupported protection value: " + raw);
	}
}
