package org.javai.declarative.state;

import java.util.Map;

public record Api(String id, String name, String description, String version, String slug,
		Map<String, String> labels) {

	public Api {
		labels = labels != null ? Map.copyOf(labels) : Map.of();
	}
}
