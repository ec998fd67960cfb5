package org.javai.declarative.plan;

import java.util.Map;

/**
 * A forward pointer from a change to another resource.
 *
 * @param ref the referenced resource's ref (or name when it lives outside the plan)
 * @param id the identifier when the planner already knows it, otherwise blank or a placeholder
 * @param lookupFields fields usable for a runtime lookup, typically {@code name}
 */
public record ReferenceInfo(String ref, String id, Map<String, String> lookupFields) {

	public ReferenceInfo {
		lookupFields = lookupFields != null ? Map.copyOf(lookupFields) : Map.of();
	}

	public static ReferenceInfo unresolved(String ref) {
		return new ReferenceInfo(ref, null, Map.of());
	}

	public static ReferenceInfo resolved(String ref, String id) {
		return new ReferenceInfo(ref, id, Map.of());
	}

	/**
	 * Whether {@link #id()} is a concrete identifier.
	 */
	public boolean hasResolvedId() {
		return Identifiers.isConcrete(id);
	}

	/**
	 * The name to use for a runtime lookup: {@code lookupFields.name} when present, else the ref.
	 */
	public String lookupName() {
		String name = lookupFields.get("name");
		return name != null && !name.isBlank() ? name : ref;
	}
}
