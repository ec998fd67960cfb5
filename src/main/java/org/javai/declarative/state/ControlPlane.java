package org.javai.declarative.state;

import java.util.Map;

public record ControlPlane(String id, String name, String description, String clusterType,
		Map<String, String> labels) {

	public ControlPlane {
		labels = labels != null ? Map.copyOf(labels) : Map.of();
	}
}
