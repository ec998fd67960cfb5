package org.javai.declarative.exec;

import org.javai.declarative.plan.Plan;
import org.javai.declarative.plan.PlannedChange;

enum SilentProgressReporter implements ProgressReporter {
	INSTANCE;

	@Override
	public void startExecution(Plan plan) {
	}

	@Override
	public void startChange(PlannedChange change) {
	}

	@Override
	public void completeChange(PlannedChange change, Throwable error) {
	}

	@Override
	public void skipChange(PlannedChange change, String reason) {
	}

	@Override
	public void finishExecution(ExecutionResult result) {
	}
}
