package org.javai.declarative.plan;

import java.util.Map;

/**
 * Typed accessors over the JSON-decoded field map of a change.
 */
public final class Fields {

	public static final String NAME = "name";
	public static final String LABELS = "labels";

	private Fields() {
	}

	/**
	 * The resource name carried by a field map, or {@link Identifiers#UNKNOWN}.
	 */
	public static String resourceName(Map<String, Object> fields) {
		if (fields != null && fields.get(NAME) instanceof String name && !name.isEmpty()) {
			return name;
		}
		return Identifiers.UNKNOWN;
	}

	public static String string(Map<String, ?> fields, String key) {
		if (fields == null) {
			return null;
		}
		Object value = fields.get(key);
		return value instanceof String text ? text : null;
	}

	@SuppressWarnings("unchecked")
	public static Map<String, Object> map(Map<String, ?> fields, String key) {
		if (fields == null) {
			return null;
		}
		Object value = fields.get(key);
		return value instanceof Map<?, ?> nested ? (Map<String, Object>) nested : null;
	}
}
