package org.javai.declarative.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.Map;
import org.javai.declarative.exec.ChangeValidationException;
import org.javai.declarative.exec.ResourceApiException;
import org.javai.declarative.exec.resource.ExecutionContext;
import org.javai.declarative.labels.Labels;
import org.javai.declarative.plan.PlannedChange;
import org.javai.declarative.plan.Protection;
import org.javai.declarative.state.PortalRequest;
import org.javai.declarative.testsupport.InMemoryStateClient;
import org.javai.declarative.testsupport.TestChanges;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PortalAdapter")
class PortalAdapterTest {

	private static final String STRATEGY_ID = "0f2c6a0e-4a4e-4b8f-9f11-5c2d3e4f5a6b";

	private final PortalAdapter adapter = new PortalAdapter(new InMemoryStateClient());

	@Nested
	@DisplayName("create mapping")
	class CreateMapping {

		@Test
		@DisplayName("maps snake_case fields and adds bookkeeping labels")
		void mapsFields() {
			PlannedChange change = TestChanges.create("1", "portal", "dev-portal")
					.field("display_name", "Developer Portal")
					.field("authentication_enabled", true)
					.field("labels", Map.of("team", "payments"))
					.field("_internal", "dropped")
					.protection(Protection.flag(true))
					.build();

			PortalRequest request = adapter.mapCreateFields(ExecutionContext.of(change, false), change.fields());

			assertThat(request.name()).isEqualTo("dev-portal");
			assertThat(request.displayName()).isEqualTo("Developer Portal");
			assertThat(request.authenticationEnabled()).isTrue();
			assertThat(request.labels())
					.containsEntry("team", "payments")
					.containsEntry(Labels.PROTECTED_KEY, "true")
					.containsEntry(Labels.MANAGED_KEY, "true")
					.containsEntry(Labels.NAMESPACE_KEY, "default");
		}

		@Test
		@DisplayName("uses the resolved auth strategy id")
		void usesResolvedStrategy() {
			PlannedChange change = TestChanges.create("1", "portal", "dev-portal")
					.field("default_application_auth_strategy_id", "__REF__:key-auth#id")
					.build();
			ExecutionContext context = ExecutionContext.of(change,
					Map.of("default_application_auth_strategy_id", STRATEGY_ID), null, false);

			PortalRequest request = adapter.mapCreateFields(context, change.fields());

			assertThat(request.defaultApplicationAuthStrategyId()).isEqualTo(STRATEGY_ID);
		}

		@Test
		@DisplayName("rejects invalid label keys and malformed fields")
		void rejectsInvalidInput() {
			PlannedChange badLabel = TestChanges.create("1", "portal", "dev-portal")
					.field("labels", Map.of("kong-team", "x"))
					.build();
			PlannedChange badField = TestChanges.create("2", "portal", "dev-portal")
					.field("rbac_enabled", Map.of("nested", true))
					.build();

			assertThatThrownBy(() -> adapter.mapCreateFields(ExecutionContext.of(badLabel, false), badLabel.fields()))
					.isInstanceOf(ChangeValidationException.class)
					.hasMessageContaining("kong-team");
			assertThatThrownBy(() -> adapter.mapCreateFields(ExecutionContext.of(badField, false), badField.fields()))
					.isInstanceOf(ChangeValidationException.class)
					.hasMessageStartingWith("invalid fields for portal");
		}
	}

	@Nested
	@DisplayName("update mapping")
	class UpdateMapping {

		@Test
		@DisplayName("replaces user labels with the desired ones")
		void replacesLabels() {
			PlannedChange change = TestChanges.update("1", "portal", "dev-portal", "id")
					.field("labels", Map.of("a", "1"))
					.build();
			ExecutionContext context = ExecutionContext.of(change, false).withProtection(Protection.flag(false));

			PortalRequest request = adapter.mapUpdateFields(context, change.fields(), Map.of("a", "1", "b", "2"));

			assertThat(Labels.userLabels(request.labels())).containsExactlyEntriesOf(Map.of("a", "1"));
		}

		@Test
		@DisplayName("keeps the current user labels when the change has none")
		void keepsLabels() {
			PlannedChange change = TestChanges.update("1", "portal", "dev-portal", "id")
					.field("description", "new")
					.build();
			ExecutionContext context = ExecutionContext.of(change, false).withProtection(Protection.flag(false));

			PortalRequest request = adapter.mapUpdateFields(context, change.fields(), Map.of("b", "2"));

			assertThat(request.labels()).containsEntry("b", "2").containsEntry(Labels.MANAGED_KEY, "true");
			assertThat(request.description()).isEqualTo("new");
		}
	}

	@Test
	@DisplayName("fails API calls when no client is configured")
	void noClient() {
		PortalAdapter withoutClient = new PortalAdapter(null);

		assertThatThrownBy(() -> withoutClient.getByName("dev-portal"))
				.isInstanceOf(ResourceApiException.class)
				.hasMessage("no API client configured for portal");
	}

	@Test
	@DisplayName("checks for an existing portal before a create only when it can look one up")
	void existenceCheck() {
		assertThat(adapter.checksExistenceOnCreate()).isTrue();
		assertThat(new PortalAdapter(null).checksExistenceOnCreate()).isFalse();
	}
}
