package org.javai.declarative.exec.resource;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.javai.declarative.exec.ReferenceResolutionException;
import org.javai.declarative.plan.PlannedChange;
import org.javai.declarative.plan.Protection;

/**
 * Everything an adapter needs to know about the change it is executing, passed explicitly.
 *
 * @param change the change being executed
 * @param namespace namespace of the change
 * @param protection protection the resource should end up with, or {@code null}
 * @param referenceIds identifiers resolved for the change's references, keyed by field
 * @param parentId identifier of the parent resource, or {@code null}
 * @param parentLookup finds the parent when {@code parentId} is not known up front; answers
 * {@code null} when the declared parent does not exist. May be {@code null}.
 * @param dryRun whether mutating calls must be skipped
 */
public record ExecutionContext(
		PlannedChange change,
		String namespace,
		Protection protection,
		Map<String, String> referenceIds,
		String parentId,
		Supplier<String> parentLookup,
		boolean dryRun) {

	public ExecutionContext {
		Objects.requireNonNull(change, "change must not be null");
		referenceIds = referenceIds != null ? Map.copyOf(referenceIds) : Map.of();
	}

	public static ExecutionContext of(PlannedChange change, Map<String, String> referenceIds, String parentId,
			boolean dryRun) {
		return new ExecutionContext(change, change.namespace(), change.protection(), referenceIds, parentId, null,
				dryRun);
	}

	/**
	 * Context for a delete. References are not resolved and the parent is only looked up
	 * when the delete needs it.
	 */
	public static ExecutionContext forDelete(PlannedChange change, Supplier<String> parentLookup, boolean dryRun) {
		return new ExecutionContext(change, change.namespace(), change.protection(), Map.of(), null, parentLookup,
				dryRun);
	}

	/**
	 * Context with no resolved references, for changes that reference nothing.
	 */
	public static ExecutionContext of(PlannedChange change, boolean dryRun) {
		return of(change, Map.of(), null, dryRun);
	}

	public ExecutionContext withProtection(Protection protection) {
		return new ExecutionContext(change, namespace, protection, referenceIds, parentId, parentLookup, dryRun);
	}

	/**
	 * @return the resolved identifier for a reference field, or {@code null}
	 */
	public String reference(String key) {
		return referenceIds.get(key);
	}

	public String requireReference(String key) {
		String id = referenceIds.get(key);
		if (id == null) {
			throw new ReferenceResolutionException("failed to resolve %s for %s '%s'".formatted(
					key, change.resourceType(), change.displayName()));
		}
		return id;
	}

	/**
	 * @return the parent's identifier, or {@code null} when it is unknown or does not exist
	 */
	public String findParentId() {
		if (parentId != null) {
			return parentId;
		}
		return parentLookup != null ? parentLookup.get() : null;
	}

	public String requireParentId() {
		String id = findParentId();
		if (id == null) {
			throw new ReferenceResolutionException("failed to resolve parent for %s '%s'".formatted(
					change.resourceType(), change.displayName()));
		}
		return id;
	}
}
