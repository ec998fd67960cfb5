package org.javai.declarative.exec.external;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts reported by the external tool's {@code --json-output}.
 */
public record DeckSummary(int created, int updated, int deleted, int total) {

	private static final Logger logger = LoggerFactory.getLogger(DeckSummary.class);
	private static final ObjectMapper mapper = new ObjectMapper();

	/**
	 * Parse the {@code summary} object from the tool's JSON output. Both the past-tense
	 * ({@code created}) and progressive ({@code creating}) key styles are understood.
	 *
	 * @return the summary, or empty when the output holds no parsable summary
	 */
	public static Optional<DeckSummary> parse(String stdout) {
		if (stdout == null || stdout.isBlank()) {
			return Optional.empty();
		}
		JsonNode root;
		try {
			root = mapper.readTree(stdout.strip());
		} catch (JsonProcessingException e) {
			logger.debug("Tool output is not JSON, no summary available: {}", e.getOriginalMessage());
			return Optional.empty();
		}
		JsonNode summary = root.path("summary");
		if (!summary.isObject()) {
			return Optional.empty();
		}
		int created = count(summary, "created", "creating");
		int updated = count(summary, "updated", "updating");
		int deleted = count(summary, "deleted", "deleting");
		int total = summary.has("total") ? summary.path("total").asInt() : created + updated + deleted;
		return Optional.of(new DeckSummary(created, updated, deleted, total));
	}

	private static int count(JsonNode summary, String pastKey, String progressiveKey) {
		if (summary.has(pastKey)) {
			return summary.path(pastKey).asInt();
		}
		return summary.path(progressiveKey).asInt();
	}
}
