package org.javai.declarative.state;

import java.util.Map;

public record AuthStrategy(String id, String name, String displayName, String strategyType,
		Map<String, String> labels) {

	public AuthStrategy {
		labels = labels != null ? Map.copyOf(labels) : Map.of();
	}
}
