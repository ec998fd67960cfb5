package org.javai.declarative.plan;

/**
 * Pointer from a child change to its parent resource.
 */
public record ParentInfo(String ref, String id) {

	public boolean hasResolvedId() {
		return Identifiers.isConcrete(id);
	}
}
