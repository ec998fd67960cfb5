package org.javai.declarative.state;

import java.util.Map;

public record Portal(String id, String name, String displayName, String description, Map<String, String> labels) {

	public Portal {
		labels = labels != null ? Map.copyOf(labels) : Map.of();
	}
}
