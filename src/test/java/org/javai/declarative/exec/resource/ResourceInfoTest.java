package org.javai.declarative.exec.resource;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.HashMap;
import java.util.Map;
import org.javai.declarative.labels.Labels;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ResourceInfo")
class ResourceInfoTest {

	@Test
	@DisplayName("keeps the labels as returned and drops null values from the normalized view")
	void rawAndNormalizedLabels() {
		// Given: labels from the API with a cleared entry
		Map<String, String> labels = new HashMap<>();
		labels.put("team", "a");
		labels.put("env", null);
		labels.put(Labels.MANAGED_KEY, "true");

		// When
		ResourceInfo info = ResourceInfo.of("id-1", "dev", labels);

		// Then
		assertThat(info.labels()).hasSize(3).containsEntry("env", null);
		assertThat(info.normalizedLabels()).hasSize(2).doesNotContainKey("env");
		assertThat(info.isManaged()).isTrue();
	}

	@Test
	@DisplayName("treats missing labels as empty")
	void missingLabels() {
		ResourceInfo info = ResourceInfo.of("id-1", "dev", null);

		assertThat(info.labels()).isEmpty();
		assertThat(info.normalizedLabels()).isEmpty();
		assertThat(info.isProtected()).isFalse();
	}
}
