package org.javai.declarative.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.declarative.exec.ChangeValidationException;
import org.javai.declarative.exec.ResourceApiException;
import org.javai.declarative.exec.resource.ExecutionContext;
import org.javai.declarative.labels.Labels;
import org.javai.declarative.plan.Fields;
import org.javai.declarative.state.StateClient;

/**
 * Shared plumbing for adapters: client access, field-to-request conversion and labels.
 */
abstract class AbstractAdapter {

	static final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

	private final StateClient client;

	AbstractAdapter(StateClient client) {
		this.client = client;
	}

	abstract String resourceType();

	/**
	 * @throws ResourceApiException when the adapter was built without a client
	 */
	StateClient client() {
		if (client == null) {
			throw new ResourceApiException("no API client configured for " + resourceType());
		}
		return client;
	}

	boolean hasClient() {
		return client != null;
	}

	/**
	 * Copy of the fields without internal keys (leading underscore).
	 */
	static Map<String, Object> payload(Map<String, Object> fields) {
		Map<String, Object> payload = new LinkedHashMap<>();
		fields.forEach((key, value) -> {
			if (!key.startsWith("_")) {
				payload.put(key, value);
			}
		});
		return payload;
	}

	<T> T convert(Map<String, Object> payload, Class<T> requestType) {
		try {
			return mapper.convertValue(payload, requestType);
		} catch (IllegalArgumentException e) {
			throw new ChangeValidationException(
					"invalid fields for %s: %s".formatted(resourceType(), e.getMessage()), e);
		}
	}

	Map<String, String> createLabels(ExecutionContext context, Map<String, Object> fields) {
		return Labels.buildCreateLabels(userLabels(fields.get(Fields.LABELS)), context.namespace(),
				context.protection());
	}

	/**
	 * Labels for an update. Without a {@code labels} field the current user labels are kept.
	 */
	Map<String, String> updateLabels(ExecutionContext context, Map<String, Object> fields,
			Map<String, String> currentLabels) {
		Map<String, String> desired = fields.containsKey(Fields.LABELS)
				? userLabels(fields.get(Fields.LABELS))
				: currentLabels;
		return Labels.buildUpdateLabels(desired, currentLabels, context.namespace(), context.protection());
	}

	private Map<String, String> userLabels(Object raw) {
		Map<String, String> labels;
		try {
			labels = Labels.extractLabels(raw);
		} catch (IllegalArgumentException e) {
			throw new ChangeValidationException("invalid labels for %s: %s".formatted(resourceType(), e.getMessage()),
					e);
		}
		if (labels == null) {
			return Map.of();
		}
		for (String key : labels.keySet()) {
			if (!Labels.isReservedKey(key)) {
				try {
					Labels.validateKey(key);
				} catch (IllegalArgumentException e) {
					throw new ChangeValidationException(e.getMessage(), e);
				}
			}
		}
		return labels;
	}
}
