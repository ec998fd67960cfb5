package org.javai.declarative.resolve;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Identifiers learned during one plan run: resources created by earlier changes and
 * successful runtime lookups, keyed by resource type and ref.
 * <p>
 * Owned by a single execution; not thread-safe.
 */
public final class ResolvedReferences {

	private final Map<String, Map<String, String>> idsByType = new HashMap<>();
	private final Map<String, String> createdResources = new LinkedHashMap<>();

	/**
	 * Record the identifier of a resource of the given type.
	 */
	public void record(String resourceType, String ref, String id) {
		Objects.requireNonNull(resourceType, "resourceType must not be null");
		if (ref == null || ref.isBlank() || id == null || id.isBlank()) {
			return;
		}
		idsByType.computeIfAbsent(resourceType, type -> new HashMap<>()).put(ref, id);
	}

	/**
	 * Record a resource created by a change of this run.
	 */
	public void recordCreated(String changeId, String resourceType, String ref, String id) {
		record(resourceType, ref, id);
		if (changeId != null && id != null && !id.isBlank()) {
			createdResources.put(changeId, id);
		}
	}

	/**
	 * @return the identifier, or {@code null} when unknown
	 */
	public String find(String resourceType, String ref) {
		if (resourceType == null || ref == null) {
			return null;
		}
		Map<String, String> ids = idsByType.get(resourceType);
		return ids == null ? null : ids.get(ref);
	}

	/**
	 * Identifiers of resources created in this run, keyed by change id.
	 */
	public Map<String, String> createdResources() {
		return Collections.unmodifiableMap(createdResources);
	}
}
