package org.javai.declarative.exec.resource;

import java.util.List;
import java.util.Map;

/**
 * Resource-specific half of a resource type that can be created and deleted.
 * Generic behaviour (required fields, dry-run, protection, error wrapping) lives in
 * {@link BaseCreateDeleteExecutor}.
 *
 * @param <C> typed create request
 */
public interface CreateDeleteOperations<C> {

	String resourceType();

	/**
	 * Field names that must be present and non-empty on a create.
	 */
	List<String> requiredFields();

	/**
	 * Fields holding references to other resources, mapped to the referenced resource type.
	 */
	default Map<String, String> referenceFields() {
		return Map.of();
	}

	/**
	 * Type of the parent resource, for child resources addressed through a parent.
	 */
	default String parentType() {
		return null;
	}

	C mapCreateFields(ExecutionContext context, Map<String, Object> fields);

	/**
	 * @return identifier of the created resource
	 */
	String create(C request, ExecutionContext context);

	void delete(String id, ExecutionContext context);

	/**
	 * @return the resource, or {@code null} when no such resource exists
	 */
	default ResourceInfo getByName(String name) {
		return null;
	}

	/**
	 * Whether {@link #getById} can look resources up; when it cannot, deletes are issued
	 * without an existence and protection check.
	 */
	default boolean supportsGetById() {
		return false;
	}

	/**
	 * @return the resource, or {@code null} when no such resource exists
	 */
	default ResourceInfo getById(String id, ExecutionContext context) {
		return null;
	}
}
