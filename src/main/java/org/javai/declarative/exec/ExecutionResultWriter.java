package org.javai.declarative.exec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Renders an {@link ExecutionResult} as JSON with snake_case property names, for
 * machine-readable output.
 */
public final class ExecutionResultWriter {

	private static final ObjectMapper mapper = new ObjectMapper()
			.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
			.setSerializationInclusion(JsonInclude.Include.NON_NULL)
			.enable(SerializationFeature.INDENT_OUTPUT);

	private ExecutionResultWriter() {
	}

	/**
	 * The result as a JSON tree, including the derived {@code message} and {@code total_changes}.
	 */
	public static ObjectNode toTree(ExecutionResult result) {
		ObjectNode node = mapper.valueToTree(result);
		node.put("total_changes", result.totalChanges());
		node.put("message", result.message());
		return node;
	}

	public static String toJson(ExecutionResult result) throws JsonProcessingException {
		return mapper.writeValueAsString(toTree(result));
	}
}
