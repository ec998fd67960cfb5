package org.javai.declarative.exec.resource;

import java.util.Map;

/**
 * Resource-specific half of a fully managed resource type: create, update and delete.
 *
 * @param <C> typed create request
 * @param <U> typed update request
 */
public interface ResourceOperations<C, U> extends CreateDeleteOperations<C> {

	/**
	 * @param currentLabels the live resource's labels without bookkeeping keys
	 */
	U mapUpdateFields(ExecutionContext context, Map<String, Object> fields, Map<String, String> currentLabels);

	/**
	 * @return identifier of the updated resource
	 */
	String update(String id, U request, ExecutionContext context);

	default boolean supportsUpdate() {
		return true;
	}

	/**
	 * Whether a create is preceded by a lookup by name that rejects duplicates.
	 */
	default boolean checksExistenceOnCreate() {
		return false;
	}
}
