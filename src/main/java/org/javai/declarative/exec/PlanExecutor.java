package org.javai.declarative.exec;

import org.javai.declarative.plan.Plan;

/**
 * Applies a plan's changes in execution order.
 */
public interface PlanExecutor {

	/**
	 * Execute every change of the plan. A failing change is recorded and execution
	 * continues with the next one.
	 *
	 * @param plan the plan to execute
	 * @return the aggregated outcome
	 * @throws NullPointerException if the plan is null
	 */
	ExecutionResult execute(Plan plan);
}
