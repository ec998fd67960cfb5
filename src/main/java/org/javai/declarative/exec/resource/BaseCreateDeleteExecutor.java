package org.javai.declarative.exec.resource;

import java.util.Map;
import java.util.Objects;
import org.javai.declarative.exec.ResourceApiException;
import org.javai.declarative.plan.PlannedChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generic create and delete for resource types that cannot be updated in place.
 * <p>
 * Child resources usually cannot be fetched by id; for those a delete answered with
 * "not found" counts as already deleted. A child whose declared parent no longer exists
 * is gone with it.
 *
 * @param <C> typed create request
 */
public class BaseCreateDeleteExecutor<C> implements ResourceExecutor {

	private static final Logger logger = LoggerFactory.getLogger(BaseCreateDeleteExecutor.class);

	private final CreateDeleteOperations<C> operations;

	public BaseCreateDeleteExecutor(CreateDeleteOperations<C> operations) {
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

	@Override
	public void delete(PlannedChange change, ExecutionContext context) {
		String type = resourceType();
		String name = change.resourceName();
		if (operations.parentType() != null && context.findParentId() == null) {
			logger.debug("Parent {} of {} '{}' is absent, nothing to delete", operations.parentType(), type, name);
			return;
		}
		if (operations.supportsGetById()) {
			ResourceInfo current = ResourceChecks.call("lookup", type, name,
					() -> operations.getById(change.resourceId(), context));
			if (current == null) {
				logger.debug("{} '{}' is already absent, nothing to delete", type, name);
				return;
			}
			BaseExecutor.checkDeletable(type, name, current, context);
		}
		if (context.dryRun()) {
			logger.debug("Dry-run: would delete {} '{}'", type, name);
			return;
		}
		try {
			ResourceChecks.run("delete", type, name, () -> operations.delete(change.resourceId(), context));
		} catch (ResourceApiException e) {
			if (ResourceChecks.isNotFound(e)) {
				logger.debug("{} '{}' is already absent, nothing to delete", type, name);
				return;
			}
			throw e;
		}
		logger.debug("Deleted {} '{}'", type, name);
	}

	@Override
	public ResourceInfo findByName(String name) {
		return operations.getByName(name);
	}
}
