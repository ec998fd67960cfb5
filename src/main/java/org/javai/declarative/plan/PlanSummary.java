package org.javai.declarative.plan;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts of planned changes by action and by resource type.
 */
public record PlanSummary(
		int totalChanges,
		Map<ActionType, Integer> byAction,
		Map<String, Integer> byResource,
		int protectionChanges) {

	public PlanSummary {
		byAction = byAction != null ? Map.copyOf(byAction) : Map.of();
		byResource = byResource != null ? Map.copyOf(byResource) : Map.of();
	}

	public static PlanSummary of(Collection<PlannedChange> changes) {
		Map<ActionType, Integer> byAction = new EnumMap<>(ActionType.class);
		Map<String, Integer> byResource = new LinkedHashMap<>();
		int protectionChanges = 0;
		for (PlannedChange change : changes) {
			byAction.merge(change.action(), 1, Integer::sum);
			byResource.merge(change.resourceType(), 1, Integer::sum);
			if (change.protection() != null && change.protection().isTransition()) {
				protectionChanges++;
			}
		}
		return new PlanSummary(changes.size(), byAction, byResource, protectionChanges);
	}

	public int count(ActionType action) {
		return byAction.getOrDefault(action, 0);
	}
}
