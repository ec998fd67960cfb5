package org.javai.declarative.labels;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.HashMap;
import java.util.Map;
import org.javai.declarative.plan.Protection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Labels")
class LabelsTest {

	@Nested
	@DisplayName("buildCreateLabels")
	class CreateLabels {

		@Test
		@DisplayName("adds namespace, protection and managed markers to the user labels")
		void addsBookkeeping() {
			Map<String, String> labels = Labels.buildCreateLabels(Map.of("team", "payments"), "billing",
					Protection.flag(true));

			assertThat(labels).containsExactlyInAnyOrderEntriesOf(Map.of(
					"team", "payments",
					Labels.NAMESPACE_KEY, "billing",
					Labels.PROTECTED_KEY, "true",
					Labels.MANAGED_KEY, "true"));
		}

		@Test
		@DisplayName("user input cannot spoof reserved keys")
		void ignoresSpoofedKeys() {
			Map<String, String> user = Map.of(
					Labels.NAMESPACE_KEY, "evil",
					Labels.PROTECTED_KEY, "true",
					"env", "prod");

			Map<String, String> labels = Labels.buildCreateLabels(user, null, null);

			assertThat(labels)
					.containsEntry(Labels.NAMESPACE_KEY, Labels.DEFAULT_NAMESPACE)
					.containsEntry(Labels.PROTECTED_KEY, "false")
					.containsEntry("env", "prod");
		}
	}

	@Nested
	@DisplayName("buildUpdateLabels")
	class UpdateLabels {

		@Test
		@DisplayName("user labels are replaced, not merged")
		void replacesUserLabels() {
			Map<String, String> current = Map.of(
					"a", "1",
					"b", "2",
					Labels.NAMESPACE_KEY, "default",
					Labels.PROTECTED_KEY, "false",
					Labels.MANAGED_KEY, "true");

			Map<String, String> labels = Labels.buildUpdateLabels(Map.of("a", "1"), current, "default",
					Protection.flag(false));

			assertThat(Labels.userLabels(labels)).containsExactlyEntriesOf(Map.of("a", "1"));
			assertThat(labels).doesNotContainKey("b");
		}

		@Test
		@DisplayName("keeps the current namespace and protection when none is given")
		void keepsCurrentBookkeeping() {
			Map<String, String> current = Map.of(
					Labels.NAMESPACE_KEY, "team-a",
					Labels.PROTECTED_KEY, "true");

			Map<String, String> labels = Labels.buildUpdateLabels(Map.of(), current, "", null);

			assertThat(labels)
					.containsEntry(Labels.NAMESPACE_KEY, "team-a")
					.containsEntry(Labels.PROTECTED_KEY, "true")
					.containsEntry(Labels.MANAGED_KEY, "true");
		}

		@Test
		@DisplayName("a protection transition sets the target state")
		void appliesTransition() {
			Map<String, String> current = Map.of(Labels.PROTECTED_KEY, "true");

			Map<String, String> labels = Labels.buildUpdateLabels(null, current, "default",
					Protection.transition(true, false));

			assertThat(labels).containsEntry(Labels.PROTECTED_KEY, "false");
		}

		@Test
		@DisplayName("reports user keys that an update removes")
		void removedKeys() {
			assertThat(Labels.removedLabelKeys(Map.of("a", "1"),
					Map.of("a", "1", "b", "2", Labels.MANAGED_KEY, "true")))
					.containsExactly("b");
		}
	}

	@Nested
	@DisplayName("inspection")
	class Inspection {

		@Test
		@DisplayName("a resource is managed when marked managed or namespaced")
		void managed() {
			assertThat(Labels.isManaged(Map.of(Labels.MANAGED_KEY, "true"))).isTrue();
			assertThat(Labels.isManaged(Map.of(Labels.NAMESPACE_KEY, "default"))).isTrue();
			assertThat(Labels.isManaged(Map.of("team", "x"))).isFalse();
			assertThat(Labels.isManaged(null)).isFalse();
		}

		@Test
		@DisplayName("only the literal 'true' marks a resource protected")
		void isProtected() {
			assertThat(Labels.isProtected(Map.of(Labels.PROTECTED_KEY, "true"))).isTrue();
			assertThat(Labels.isProtected(Map.of(Labels.PROTECTED_KEY, "yes"))).isFalse();
		}

		@Test
		@DisplayName("normalize drops null values")
		void normalize() {
			Map<String, String> labels = new HashMap<>();
			labels.put("a", "1");
			labels.put("b", null);

			assertThat(Labels.normalize(labels)).containsOnlyKeys("a");
		}

		@Test
		@DisplayName("extractLabels stringifies values and rejects non-maps")
		void extractLabels() {
			assertThat(Labels.extractLabels(Map.of("tier", 1))).containsEntry("tier", "1");
			assertThat(Labels.extractLabels(null)).isNull();
			assertThatThrownBy(() -> Labels.extractLabels("tier=1"))
					.isInstanceOf(IllegalArgumentException.class);
		}
	}

	@Nested
	@DisplayName("validateKey")
	class KeyValidation {

		@Test
		@DisplayName("accepts ordinary keys")
		void acceptsOrdinaryKeys() {
			Labels.validateKey("team");
			Labels.validateKey("cost-center");
		}

		@Test
		@DisplayName("rejects empty, long and reserved keys")
		void rejectsBadKeys() {
			assertThatThrownBy(() -> Labels.validateKey("")).hasMessageContaining("empty");
			assertThatThrownBy(() -> Labels.validateKey("x".repeat(Labels.MAX_KEY_LENGTH + 1)))
					.hasMessageContaining("exceeds");
			assertThatThrownBy(() -> Labels.validateKey(Labels.MANAGED_KEY)).hasMessageContaining("reserved");
			assertThatThrownBy(() -> Labels.validateKey("Konnect-owner")).hasMessageContaining("must not start");
			assertThatThrownBy(() -> Labels.validateKey("_internal")).hasMessageContaining("must not start");
		}
	}
}
