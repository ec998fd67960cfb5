package org.javai.declarative.plan;

import java.time.Instant;

/**
 * Execution metadata recorded by the planner.
 */
public record PlanMetadata(String version, Instant generatedAt, String generator, PlanMode mode) {

	public static final String CURRENT_VERSION = "1.0";

	public PlanMetadata {
		version = version != null ? version : CURRENT_VERSION;
		mode = mode != null ? mode : PlanMode.APPLY;
	}

	public static PlanMetadata of(PlanMode mode) {
		return new PlanMetadata(CURRENT_VERSION, Instant.now(), "kongctl", mode);
	}
}
