package org.javai.declarative.exec;

import static org.assertj.core.api.Assertions.assertThat;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.javai.declarative.exec.ExecutionResult.ExecutionError;
import org.javai.declarative.exec.ExecutionResult.ValidationResult;
import org.javai.declarative.exec.ExecutionResult.ValidationStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ExecutionResultWriter")
class ExecutionResultWriterTest {

	@Test
	@DisplayName("writes snake_case JSON with the derived message")
	void writesJson() throws Exception {
		ExecutionResult result = new ExecutionResult(0, 1, 1,
				List.of(new ExecutionError("2", "portal", "old", "old", "UPDATE", "boom", ErrorKind.API)),
				List.of(),
				List.of(new ValidationResult("1", "portal", "dev", "dev", "CREATE", ValidationStatus.WOULD_SUCCEED,
						ValidationResult.PASSED, "would create portal")),
				true);

		JsonNode json = new ObjectMapper().readTree(ExecutionResultWriter.toJson(result));

		assertThat(json.path("success_count").asInt()).isZero();
		assertThat(json.path("failure_count").asInt()).isEqualTo(1);
		assertThat(json.path("skipped_count").asInt()).isEqualTo(1);
		assertThat(json.path("total_changes").asInt()).isEqualTo(2);
		assertThat(json.path("dry_run").asBoolean()).isTrue();
		assertThat(json.path("message").asText()).isEqualTo("Dry-run complete with errors. No changes were made.");
		assertThat(json.path("errors").get(0).path("change_id").asText()).isEqualTo("2");
		assertThat(json.path("errors").get(0).path("kind").asText()).isEqualTo("API");
		assertThat(json.path("validation_results").get(0).path("status").asText()).isEqualTo("would_succeed");
	}

	@Test
	@DisplayName("the summary message covers all four outcomes")
	void messages() {
		assertThat(new ExecutionResult(1, 0, 0, null, null, null, false).message())
				.isEqualTo("Execution completed successfully.");
		assertThat(new ExecutionResult(0, 1, 0, null, null, null, false).message())
				.isEqualTo("Execution completed with errors.");
		assertThat(new ExecutionResult(0, 0, 1, null, null, null, true).message())
				.isEqualTo("Dry-run complete. No changes were made.");
		assertThat(new ExecutionResult(0, 1, 0, null, null, null, true).message())
				.isEqualTo("Dry-run complete with errors. No changes were made.");
	}
}
