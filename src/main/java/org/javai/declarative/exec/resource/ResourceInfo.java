package org.javai.declarative.exec.resource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.declarative.labels.Labels;

/**
 * Live state of a resource as returned by a lookup, reduced to what the executor needs.
 *
 * @param id remote identifier
 * @param name resource name
 * @param labels labels as returned by the API, null values included
 * @param normalizedLabels {@code labels} without null values
 */
public record ResourceInfo(String id, String name, Map<String, String> labels, Map<String, String> normalizedLabels) {

	public ResourceInfo {
		labels = labels != null ? Collections.unmodifiableMap(new LinkedHashMap<>(labels)) : Map.of();
		normalizedLabels = normalizedLabels != null ? Map.copyOf(Labels.normalize(normalizedLabels)) : Map.of();
	}

	public static ResourceInfo of(String id, String name, Map<String, String> labels) {
		return new ResourceInfo(id, name, labels, Labels.normalize(labels));
	}

	public boolean isProtected() {
		return Labels.isProtected(normalizedLabels);
	}

	public boolean isManaged() {
		return Labels.isManaged(normalizedLabels);
	}
}
