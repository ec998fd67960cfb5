package org.javai.declarative.exec.resource;

import java.util.Map;
import org.javai.declarative.exec.UnsupportedChangeException;
import org.javai.declarative.plan.PlannedChange;

/**
 * Executes changes of one resource type. The plan executor dispatches to these by
 * resource type.
 */
public interface ResourceExecutor {

	String resourceType();

	/**
	 * @return identifier of the created resource, or a placeholder in dry-run
	 */
	String create(PlannedChange change, ExecutionContext context);

	default String update(PlannedChange change, ExecutionContext context) {
		throw new UnsupportedChangeException("update operation not yet implemented for " + resourceType());
	}

	void delete(PlannedChange change, ExecutionContext context);

	/**
	 * Checked before a create: fails when a resource of the same name already exists.
	 *
	 * @throws org.javai.declarative.exec.ChangeValidationException when it does
	 */
	default void verifyCreatable(PlannedChange change) {
	}

	/**
	 * Look a resource of this type up by name, for reference resolution.
	 *
	 * @return the resource, or {@code null} when absent or when this type cannot be looked up by name
	 */
	ResourceInfo findByName(String name);

	default Map<String, String> referenceFields() {
		return Map.of();
	}

	default String parentType() {
		return null;
	}
}
