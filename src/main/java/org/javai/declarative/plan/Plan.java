package org.javai.declarative.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An ordered collection of changes produced by the planner, plus the order in which
 * they must be applied.
 * <p>
 * The execution order is trusted as given; it is never re-derived from dependencies.
 */
public final class Plan {

	private final PlanMetadata metadata;
	private final Map<String, PlannedChange> changes = new LinkedHashMap<>();
	private final List<String> executionOrder = new ArrayList<>();
	private PlanSummary summary = PlanSummary.of(List.of());

	private Plan(PlanMetadata metadata) {
		this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
	}

	public static Plan create(PlanMode mode) {
		return new Plan(PlanMetadata.of(mode));
	}

	public static Plan create(PlanMetadata metadata) {
		return new Plan(metadata);
	}

	/**
	 * Convenience for the common case: the execution order is the insertion order.
	 */
	public static Plan of(PlanMode mode, List<PlannedChange> changes) {
		Plan plan = create(mode);
		for (PlannedChange change : changes) {
			plan.addChange(change);
		}
		plan.setExecutionOrder(changes.stream().map(PlannedChange::id).toList());
		return plan;
	}

	public Plan addChange(PlannedChange change) {
		Objects.requireNonNull(change, "change must not be null");
		if (changes.putIfAbsent(change.id(), change) != null) {
			throw new IllegalArgumentException("duplicate change id: " + change.id());
		}
		summary = PlanSummary.of(changes.values());
		return this;
	}

	public Plan setExecutionOrder(List<String> order) {
		executionOrder.clear();
		if (order != null) {
			executionOrder.addAll(order);
		}
		return this;
	}

	public PlanMetadata metadata() {
		return metadata;
	}

	public PlanMode mode() {
		return metadata.mode();
	}

	public List<PlannedChange> changes() {
		return List.copyOf(changes.values());
	}

	public List<String> executionOrder() {
		return Collections.unmodifiableList(executionOrder);
	}

	public PlanSummary summary() {
		return summary;
	}

	/**
	 * @return the change with this id, or {@code null}
	 */
	public PlannedChange findChange(String id) {
		return id == null ? null : changes.get(id);
	}

	public boolean isEmpty() {
		return changes.isEmpty();
	}

	public boolean containsDeletes() {
		return summary.count(ActionType.DELETE) > 0;
	}
}
