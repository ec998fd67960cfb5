package org.javai.declarative.exec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.declarative.adapter.DefaultResourceExecutors;
import org.javai.declarative.exec.external.DeckStep;
import org.javai.declarative.exec.external.ExternalToolRunner;
import org.javai.declarative.exec.external.ProcessExternalToolRunner;
import org.javai.declarative.exec.resource.ExecutionContext;
import org.javai.declarative.exec.resource.ResourceExecutor;
import org.javai.declarative.exec.resource.ResourceInfo;
import org.javai.declarative.plan.ActionType;
import org.javai.declarative.plan.Plan;
import org.javai.declarative.plan.PlannedChange;
import org.javai.declarative.resolve.ReferenceResolver;
import org.javai.declarative.resolve.ResolvedReferences;
import org.javai.declarative.state.StateClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sequential executor for plans.
 *
 * <p>Walks the plan's execution order one change at a time. A change that fails is
 * recorded in the result and execution continues with the next one; nothing is rolled
 * back. In dry-run mode every change is validated, including the read-side checks
 * against the live resources, but no mutating call is made.</p>
 *
 * <p>Deletes resolve no references: whether the resource still exists is checked first, and
 * a child's parent is only looked up when the delete call needs it.</p>
 *
 * <pre>{@code
 * PlanExecutor executor = DefaultPlanExecutor.builder()
 *     .withClient(client)
 *     .withReporter(new ConsoleProgressReporter(System.out, false))
 *     .withOptions(options)
 *     .build();
 * ExecutionResult result = executor.execute(plan);
 * }</pre>
 *
 * <p>An instance may be reused for several plans but must not execute two plans at once.</p>
 */
public class DefaultPlanExecutor implements PlanExecutor {

	private static final Logger logger = LoggerFactory.getLogger(DefaultPlanExecutor.class);

	private final Map<String, ResourceExecutor> executors;
	private final ProgressReporter reporter;
	private final ExecutorOptions options;
	private final DeckStep deckStep;

	private DefaultPlanExecutor(Builder builder) {
		this.options = builder.options != null ? builder.options : ExecutorOptions.defaults();
		this.reporter = builder.reporter != null ? builder.reporter : ProgressReporter.silent();
		Map<String, ResourceExecutor> registered = new LinkedHashMap<>();
		if (builder.registerDefaults) {
			for (ResourceExecutor executor : DefaultResourceExecutors.create(builder.client)) {
				registered.put(executor.resourceType(), executor);
			}
		}
		for (ResourceExecutor executor : builder.executors) {
			registered.put(executor.resourceType(), executor);
		}
		this.executors = Map.copyOf(registered);
		ExternalToolRunner runner = builder.toolRunner != null
				? builder.toolRunner
				: new ProcessExternalToolRunner(options.deckExecutable());
		this.deckStep = new DeckStep(runner, builder.client, options);
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public ExecutionResult execute(Plan plan) {
		Objects.requireNonNull(plan, "plan must not be null");
		boolean dryRun = options.dryRun();
		ExecutionResult.Builder result = new ExecutionResult.Builder(dryRun);
		ReferenceResolver resolver = new ReferenceResolver(new ResolvedReferences(), this::findIdByName);

		logger.debug("Executing plan with {} change(s), dryRun={}", plan.executionOrder().size(), dryRun);
		reporter.startExecution(plan);
		for (String changeId : plan.executionOrder()) {
			PlannedChange change = plan.findChange(changeId);
			if (change == null) {
				String message = "change with ID " + changeId + " not found in plan";
				logger.warn(message);
				result.missing(changeId, message);
				continue;
			}
			executeChange(change, plan, resolver, result, dryRun);
		}
		ExecutionResult finished = result.build();
		reporter.finishExecution(finished);
		logger.debug("Plan finished: {} succeeded, {} failed, {} skipped", finished.successCount(),
				finished.failureCount(), finished.skippedCount());
		return finished;
	}

	private void executeChange(PlannedChange change, Plan plan, ReferenceResolver resolver,
			ExecutionResult.Builder result, boolean dryRun) {
		logger.debug("Executing change {} ({} {} '{}')", change.id(), change.action(), change.resourceType(),
				change.displayName());
		reporter.startChange(change);
		String resourceId;
		try {
			validateChangePreExecution(change);
			resourceId = apply(change, plan, resolver, dryRun);
		} catch (ChangeExecutionException e) {
			fail(change, e, result);
			return;
		} catch (RuntimeException e) {
			fail(change, new ChangeExecutionException(ErrorKind.UNEXPECTED,
					"unexpected error: " + e.getMessage(), e), result);
			return;
		}

		if (change.action() == ActionType.CREATE) {
			resolver.table().recordCreated(change.id(), change.resourceType(), change.resourceRef(), resourceId);
		}
		if (dryRun) {
			result.skipped(change, "would " + change.action().operation() + " " + change.resourceType());
			reporter.skipChange(change, "dry-run mode");
		} else {
			result.applied(change, resourceId);
			reporter.completeChange(change, null);
		}
	}

	private void fail(PlannedChange change, ChangeExecutionException error, ExecutionResult.Builder result) {
		logger.warn("Change {} ({} {} '{}') failed: {}", change.id(), change.action(), change.resourceType(),
				change.displayName(), error.getMessage());
		result.failed(change, error);
		reporter.completeChange(change, error);
	}

	static void validateChangePreExecution(PlannedChange change) {
		ActionType action = change.action();
		if ((action == ActionType.UPDATE || action == ActionType.DELETE) && !change.hasResourceId()) {
			throw new ChangeValidationException("resource ID required for " + action.name() + " operation");
		}
	}

	private String apply(PlannedChange change, Plan plan, ReferenceResolver resolver, boolean dryRun) {
		if (change.action() == ActionType.EXTERNAL_TOOL) {
			if (!DeckStep.RESOURCE_TYPE.equals(change.resourceType())) {
				throw new UnsupportedChangeException(
						"external tool operation not yet implemented for " + change.resourceType());
			}
			return deckStep.execute(change, plan, resolver, dryRun);
		}

		ResourceExecutor executor = executors.get(change.resourceType());
		if (executor == null) {
			throw new UnsupportedChangeException("%s operation not yet implemented for %s".formatted(
					change.action().operation(), change.resourceType()));
		}

		if (change.action() == ActionType.DELETE) {
			String parentType = executor.parentType();
			ExecutionContext context = ExecutionContext.forDelete(change,
					parentType != null ? () -> resolver.findParent(change, parentType) : null, dryRun);
			executor.delete(change, context);
			return change.resourceId();
		}
		if (change.action() == ActionType.CREATE) {
			executor.verifyCreatable(change);
		}

		Map<String, String> referenceIds = resolver.resolveAll(change, executor.referenceFields());
		String parentId = executor.parentType() != null ? resolver.resolveParent(change, executor.parentType()) : null;
		ExecutionContext context = ExecutionContext.of(change, referenceIds, parentId, dryRun);

		return switch (change.action()) {
			case CREATE -> executor.create(change, context);
			case UPDATE -> executor.update(change, context);
			case DELETE, EXTERNAL_TOOL -> throw new IllegalStateException(
					change.action() + " changes are handled above");
		};
	}

	private String findIdByName(String resourceType, String name) {
		ResourceExecutor executor = executors.get(resourceType);
		if (executor == null) {
			throw new ReferenceResolutionException("no lookup available for resource type " + resourceType);
		}
		ResourceInfo info = executor.findByName(name);
		return info != null ? info.id() : null;
	}

	/**
	 * Builder for configuring a {@link DefaultPlanExecutor}.
	 */
	public static final class Builder {
		private StateClient client;
		private ProgressReporter reporter;
		private ExecutorOptions options;
		private ExternalToolRunner toolRunner;
		private boolean registerDefaults = true;
		private final List<ResourceExecutor> executors = new ArrayList<>();

		private Builder() {
		}

		/**
		 * Set the remote API client. Without one, any change that needs a remote call fails.
		 */
		public Builder withClient(StateClient client) {
			this.client = client;
			return this;
		}

		public Builder withReporter(ProgressReporter reporter) {
			this.reporter = reporter;
			return this;
		}

		public Builder withOptions(ExecutorOptions options) {
			this.options = options;
			return this;
		}

		/**
		 * Replace the process-based runner for external-tool changes.
		 */
		public Builder withToolRunner(ExternalToolRunner toolRunner) {
			this.toolRunner = toolRunner;
			return this;
		}

		/**
		 * Register an executor, replacing any default for the same resource type.
		 */
		public Builder withResourceExecutor(ResourceExecutor executor) {
			this.executors.add(Objects.requireNonNull(executor, "executor must not be null"));
			return this;
		}

		/**
		 * Do not register the built-in resource executors.
		 */
		public Builder withoutDefaultResources() {
			this.registerDefaults = false;
			return this;
		}

		public DefaultPlanExecutor build() {
			return new DefaultPlanExecutor(this);
		}
	}
}
