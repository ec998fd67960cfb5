package org.javai.declarative.exec;

import org.javai.declarative.plan.Plan;
import org.javai.declarative.plan.PlannedChange;

/**
 * Observes a plan run. Purely observational: the executor behaves the same with or
 * without a reporter.
 */
public interface ProgressReporter {

	void startExecution(Plan plan);

	void startChange(PlannedChange change);

	/**
	 * @param error the failure, or {@code null} on success
	 */
	void completeChange(PlannedChange change, Throwable error);

	void skipChange(PlannedChange change, String reason);

	void finishExecution(ExecutionResult result);

	/**
	 * A reporter that ignores every event.
	 */
	static ProgressReporter silent() {
		return SilentProgressReporter.INSTANCE;
	}
}
