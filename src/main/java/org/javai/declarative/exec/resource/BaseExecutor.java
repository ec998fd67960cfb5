package org.javai.declarative.exec.resource;

import java.util.Map;
import java.util.Objects;
import org.javai.declarative.exec.ChangeValidationException;
import org.javai.declarative.exec.ProtectionViolationException;
import org.javai.declarative.exec.ResourceApiException;
import org.javai.declarative.exec.UnsupportedChangeException;
import org.javai.declarative.labels.Labels;
import org.javai.declarative.labels.ProtectionPolicy;
import org.javai.declarative.plan.ActionType;
import org.javai.declarative.plan.PlannedChange;
import org.javai.declarative.plan.Protection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generic create, update and delete for a resource type, delegating the
 * resource-specific parts to {@link ResourceOperations}.
 *
 * <p>Updates and deletes re-fetch the live resource first, so that protection and
 * ownership are checked against the state at execution time rather than at plan time.</p>
 *
 * @param <C> typed create request
 * @param <U> typed update request
 */
public class BaseExecutor<C, U> implements ResourceExecutor {

	private static final Logger logger = LoggerFactory.getLogger(BaseExecutor.class);

	private final ResourceOperations<C, U> operations;

	public BaseExecutor(ResourceOperations<C, U> operations) {
		this.operations = Objects.requireNonNull(operations, "operations must not be null");
	}

	@Override
	public String resourceType() {
		return operations.resourceType();
	}

	@Override
	public Map<String, String> referenceFields() {
		return operations.referenceFields();
	}

	@Override
	public String parentType() {
		return operations.parentType();
	}

	@Override
	public String create(PlannedChange change, ExecutionContext context) {
		String type = resourceType();
		String name = change.resourceName();
		ResourceChecks.validateRequiredFields(type, change, operations.requiredFields());

		C request = operations.mapCreateFields(context, change.fields());
		if (context.dryRun()) {
			logger.debug("Dry-run: would create {} '{}'", type, name);
			return ResourceChecks.dryRunId(type);
		}
		String id = ResourceChecks.call("create", type, name, () -> operations.create(request, context));
		logger.debug("Created {} '{}' with id {}", type, name, id);
		return id;
	}

	/**
	 * A lookup answered with "not found" counts as no existing resource.
	 */
	@Override
	public void verifyCreatable(PlannedChange change) {
		if (!operations.checksExistenceOnCreate()) {
			return;
		}
		String type = resourceType();
		String name = change.resourceName();
		ResourceInfo existing;
		try {
			existing = ResourceChecks.call("check existence", type, name,
					() -> operations.getByName(change.lookupName()));
		} catch (ResourceApiException e) {
			if (!ResourceChecks.isNotFound(e)) {
				throw e;
			}
			logger.debug("Lookup of {} '{}' answered not found", type, name);
			existing = null;
		}
		if (existing != null) {
			throw new ChangeValidationException("%s '%s' already exists".formatted(type, name));
		}
	}

	@Override
	public String update(PlannedChange change, ExecutionContext context) {
		String type = resourceType();
		String name = change.resourceName();
		if (!operations.supportsUpdate()) {
			throw new UnsupportedChangeException(type + " does not support update operations");
		}

		ResourceInfo current = ResourceChecks.call("lookup", type, name,
				() -> operations.getByName(change.lookupName()));
		if (current == null) {
			throw new ChangeValidationException("%s '%s' no longer exists".formatted(type, name));
		}

		boolean isProtected = Labels.isProtected(current.normalizedLabels());
		boolean isProtectionChange = ProtectionPolicy.isProtectionChange(context.protection());
		ProtectionPolicy.validate(type, name, isProtected, ActionType.UPDATE, isProtectionChange);
		if (isProtected && isProtectionChange) {
			ProtectionPolicy.validateTransitionOnly(type, name, change.fields());
		}

		ExecutionContext effective = context.protection() != null
				? context
				: context.withProtection(Protection.flag(isProtected));
		Map<String, String> currentLabels = Labels.userLabels(current.normalizedLabels());
		U request = operations.mapUpdateFields(effective, change.fields(), currentLabels);
		if (context.dryRun()) {
			logger.debug("Dry-run: would update {} '{}'", type, name);
			return change.resourceId();
		}
		String id = ResourceChecks.call("update", type, name,
				() -> operations.update(change.resourceId(), request, effective));
		logger.debug("Updated {} '{}'", type, name);
		return id != null ? id : change.resourceId();
	}

	@Override
	public void delete(PlannedChange change, ExecutionContext context) {
		String type = resourceType();
		String name = change.resourceName();
		ResourceInfo current = ResourceChecks.call("lookup", type, name,
				() -> operations.getByName(change.lookupName()));
		if (current == null) {
			logger.debug("{} '{}' is already absent, nothing to delete", type, name);
			return;
		}
		checkDeletable(type, name, current, context);
		if (context.dryRun()) {
			logger.debug("Dry-run: would delete {} '{}'", type, name);
			return;
		}
		ResourceChecks.run("delete", type, name, () -> operations.delete(change.resourceId(), context));
		logger.debug("Deleted {} '{}'", type, name);
	}

	@Override
	public ResourceInfo findByName(String name) {
		return operations.getByName(name);
	}

	static void checkDeletable(String type, String name, ResourceInfo current, ExecutionContext context) {
		ProtectionPolicy.validate(type, name, current.isProtected(), ActionType.DELETE,
				ProtectionPolicy.isProtectionChange(context.protection()));
		if (!current.isManaged()) {
			throw new ProtectionViolationException(
					"cannot delete %s '%s': not a KONGCTL-managed resource".formatted(type, name));
		}
	}
}
