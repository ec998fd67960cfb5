package org.javai.declarative.exec;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.declarative.plan.PlannedChange;

/**
 * Aggregated outcome of one {@link PlanExecutor#execute} call.
 * <p>
 * Every change in the execution order is counted exactly once, as a success,
 * a failure or (in dry-run) a skip.
 *
 * @param successCount changes applied
 * @param failureCount changes that failed, in any mode
 * @param skippedCount changes validated but not applied (dry-run)
 * @param errors one entry per failed change
 * @param changesApplied one entry per applied change
 * @param validationResults dry-run outcome per change
 * @param dryRun whether the run was a dry-run
 */
public record ExecutionResult(
		int successCount,
		int failureCount,
		int skippedCount,
		List<ExecutionError> errors,
		List<AppliedChange> changesApplied,
		List<ValidationResult> validationResults,
		boolean dryRun
) {

	public ExecutionResult {
		errors = errors != null ? List.copyOf(errors) : List.of();
		changesApplied = changesApplied != null ? List.copyOf(changesApplied) : List.of();
		validationResults = validationResults != null ? List.copyOf(validationResults) : List.of();
	}

	public boolean hasErrors() {
		return failureCount > 0 || !errors.isEmpty();
	}

	public int totalChanges() {
		return successCount + failureCount + skippedCount;
	}

	/**
	 * One-line summary for the user.
	 */
	public String message() {
		if (dryRun) {
			return hasErrors()
					? "Dry-run complete with errors. No changes were made."
					: "Dry-run complete. No changes were made.";
		}
		return hasErrors() ? "Execution completed with errors." : "Execution completed successfully.";
	}

	/**
	 * A failed change.
	 */
	public record ExecutionError(
			String changeId,
			String resourceType,
			String resourceName,
			String resourceRef,
			String action,
			String error,
			ErrorKind kind) {
	}

	/**
	 * A change that was applied, with the identifier of the affected resource.
	 */
	public record AppliedChange(
			String changeId,
			String resourceType,
			String resourceName,
			String resourceRef,
			String action,
			String resourceId) {
	}

	/**
	 * Dry-run verdict for a change.
	 */
	public record ValidationResult(
			String changeId,
			String resourceType,
			String resourceName,
			String resourceRef,
			String action,
			ValidationStatus status,
			String validation,
			String message) {

		public static final String PASSED = "passed";
		public static final String FAILED = "failed";
	}

	public enum ValidationStatus {
		WOULD_SUCCEED("would_succeed"),
		WOULD_FAIL("would_fail");

		private final String value;

		ValidationStatus(String value) {
			this.value = value;
		}

		@JsonValue
		public String value() {
			return value;
		}
	}

	/**
	 * Accumulates a result while a plan runs. Owned by a single execution.
	 */
	static final class Builder {

		private final boolean dryRun;
		private int successCount;
		private int failureCount;
		private int skippedCount;
		private final List<ExecutionError> errors = new ArrayList<>();
		private final List<AppliedChange> changesApplied = new ArrayList<>();
		private final List<ValidationResult> validationResults = new ArrayList<>();

		Builder(boolean dryRun) {
			this.dryRun = dryRun;
		}

		void applied(PlannedChange change, String resourceId) {
			successCount++;
			changesApplied.add(new AppliedChange(change.id(), change.resourceType(), change.resourceName(),
					change.resourceRef(), change.action().name(), resourceId));
		}

		void skipped(PlannedChange change, String message) {
			skippedCount++;
			validationResults.add(new ValidationResult(change.id(), change.resourceType(), change.resourceName(),
					change.resourceRef(), change.action().name(), ValidationStatus.WOULD_SUCCEED,
					ValidationResult.PASSED, message));
		}

		void failed(PlannedChange change, ChangeExecutionException error) {
			Objects.requireNonNull(error, "error must not be null");
			failureCount++;
			errors.add(new ExecutionError(change.id(), change.resourceType(), change.resourceName(),
					change.resourceRef(), change.action().name(), error.getMessage(), error.kind()));
			if (dryRun) {
				validationResults.add(new ValidationResult(change.id(), change.resourceType(),
						change.resourceName(), change.resourceRef(), change.action().name(),
						ValidationStatus.WOULD_FAIL, ValidationResult.FAILED, error.getMessage()));
			}
		}

		/**
		 * An execution-order entry with no matching change.
		 */
		void missing(String changeId, String message) {
			failureCount++;
			errors.add(new ExecutionError(changeId, null, null, null, null, message, ErrorKind.VALIDATION));
		}

		ExecutionResult build() {
			return new ExecutionResult(successCount, failureCount, skippedCount, errors, changesApplied,
					validationResults, dryRun);
		}
	}
}
