package org.javai.declarative.testsupport;

import java.util.Map;
import org.javai.declarative.labels.Labels;
import org.javai.declarative.plan.ActionType;
import org.javai.declarative.plan.PlannedChange;

/**
 * Shorthand for building changes in tests.
 */
public final class TestChanges {

	private TestChanges() {
	}

	public static PlannedChange.Builder create(String id, String type, String name) {
		return PlannedChange.builder(id, ActionType.CREATE, type)
				.resourceRef(name)
				.namespace(Labels.DEFAULT_NAMESPACE)
				.field("name", name);
	}

	public static PlannedChange.Builder update(String id, String type, String name, String resourceId) {
		return PlannedChange.builder(id, ActionType.UPDATE, type)
				.resourceRef(name)
				.resourceId(resourceId)
				.namespace(Labels.DEFAULT_NAMESPACE)
				.field("name", name);
	}

	public static PlannedChange.Builder delete(String id, String type, String name, String resourceId) {
		return PlannedChange.builder(id, ActionType.DELETE, type)
				.resourceRef(name)
				.resourceId(resourceId)
				.namespace(Labels.DEFAULT_NAMESPACE)
				.field("name", name);
	}

	/**
	 * Labels of a resource managed in the default namespace.
	 */
	public static Map<String, String> managedLabels(boolean isProtected) {
		return Map.of(
				Labels.NAMESPACE_KEY, Labels.DEFAULT_NAMESPACE,
				Labels.MANAGED_KEY, Labels.TRUE,
				Labels.PROTECTED_KEY, isProtected ? Labels.TRUE : Labels.FALSE);
	}
}
