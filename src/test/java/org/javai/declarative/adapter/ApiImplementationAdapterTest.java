package org.javai.declarative.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.Map;
import org.javai.declarative.exec.ReferenceResolutionException;
import org.javai.declarative.exec.resource.ExecutionContext;
import org.javai.declarative.plan.ActionType;
import org.javai.declarative.plan.PlannedChange;
import org.javai.declarative.state.ApiImplementationRequest;
import org.javai.declarative.testsupport.InMemoryStateClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ApiImplementationAdapter")
class ApiImplementationAdapterTest {

	private static final String SERVICE_ID = "9c8b7a69-5847-4362-a150-f1e2d3c4b5a6";
	private static final String CONTROL_PLANE_ID = "1a2b3c4d-5e6f-4a0b-8c1d-2e3f4a5b6c7d";

	private final ApiImplementationAdapter adapter = new ApiImplementationAdapter(new InMemoryStateClient());

	private static PlannedChange implementation(String serviceId, String controlPlaneId) {
		return PlannedChange.builder("1", ActionType.CREATE, "api_implementation")
				.resourceRef("orders-impl")
				.field("service", Map.of("id", serviceId, "control_plane_id", controlPlaneId))
				.build();
	}

	@Test
	@DisplayName("maps a concrete service reference")
	void mapsService() {
		PlannedChange change = implementation(SERVICE_ID, CONTROL_PLANE_ID);

		ApiImplementationRequest request = adapter.mapCreateFields(ExecutionContext.of(change, false), change.fields());

		assertThat(request.service().id()).isEqualTo(SERVICE_ID);
		assertThat(request.service().controlPlaneId()).isEqualTo(CONTROL_PLANE_ID);
		assertThat(adapter.parentType()).isEqualTo("api");
	}

	@Test
	@DisplayName("rejects an unpatched placeholder outside dry-run")
	void rejectsPlaceholder() {
		PlannedChange change = implementation("__REF__:users-svc#id", CONTROL_PLANE_ID);

		assertThatThrownBy(() -> adapter.mapCreateFields(ExecutionContext.of(change, false), change.fields()))
				.isInstanceOf(ReferenceResolutionException.class)
				.hasMessageContaining("__REF__:users-svc#id");
	}

	@Test
	@DisplayName("accepts a placeholder in dry-run")
	void acceptsPlaceholderInDryRun() {
		PlannedChange change = implementation("__REF__:users-svc#id", "__REF__:cp#id");

		ApiImplementationRequest request = adapter.mapCreateFields(ExecutionContext.of(change, true), change.fields());

		assertThat(request.service().id()).isEqualTo("__REF__:users-svc#id");
	}

	@Test
	@DisplayName("rejects a control plane id that is not an identifier")
	void rejectsControlPlaneName() {
		PlannedChange change = implementation(SERVICE_ID, "cp-main");

		assertThatThrownBy(() -> adapter.mapCreateFields(ExecutionContext.of(change, false), change.fields()))
				.isInstanceOf(ReferenceResolutionException.class)
				.hasMessageContaining("cp-main");
	}

	@Test
	@DisplayName("needs the parent API id to create")
	void needsParent() {
		PlannedChange change = implementation(SERVICE_ID, CONTROL_PLANE_ID);
		ExecutionContext context = ExecutionContext.of(change, false);
		ApiImplementationRequest request = adapter.mapCreateFields(context, change.fields());

		assertThatThrownBy(() -> adapter.create(request, context))
				.isInstanceOf(ReferenceResolutionException.class)
				.hasMessage("failed to resolve parent for api_implementation 'orders-impl'");
	}
}
