package org.javai.declarative.plan;

import java.util.Optional;

/**
 * A deferred reference written by the planner in place of an identifier it cannot know yet,
 * in the form {@code __REF__:<ref>#<field>}.
 */
public record RefPlaceholder(String ref, String field) {

	public static final String PREFIX = "__REF__:";

	public RefPlaceholder {
		if (ref == null || ref.isBlank()) {
			throw new IllegalArgumentException("placeholder ref must not be blank");
		}
		field = field == null || field.isBlank() ? "id" : field;
	}

	public static boolean isPlaceholder(String value) {
		return value != null && value.startsWith(PREFIX);
	}

	/**
	 * Parse a placeholder; a value without a {@code #field} suffix refers to {@code id}.
	 */
	public static Optional<RefPlaceholder> parse(String value) {
		if (!isPlaceholder(value)) {
			return Optional.empty();
		}
		String body = value.substring(PREFIX.length());
		int hash = body.lastIndexOf('#');
		String ref = hash >= 0 ? body.substring(0, hash) : body;
		String field = hash >= 0 ? body.substring(hash + 1) : "id";
		if (ref.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(new RefPlaceholder(ref, field));
	}

	@Override
	public String toString() {
		return PREFIX + ref + "#" + field;
	}
}
