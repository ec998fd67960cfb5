package org.javai.declarative.exec.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.util.List;
import java.util.Map;
import org.javai.declarative.exec.ProtectionViolationException;
import org.javai.declarative.exec.ResourceApiException;
import org.javai.declarative.exec.UnsupportedChangeException;
import org.javai.declarative.plan.ActionType;
import org.javai.declarative.plan.PlannedChange;
import org.javai.declarative.plan.Protection;
import org.javai.declarative.state.ApiClientException;
import org.javai.declarative.testsupport.TestChanges;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@DisplayName("BaseCreateDeleteExecutor")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BaseCreateDeleteExecutorTest {

	private static final String VERSION_ID = "5e4d3c2b-1a09-4f8e-9d7c-6b5a49382716";
	private static final String API_ID = "8a7b6c5d-4e3f-4a2b-9c1d-0e9f8a7b6c5d";

	@Mock
	private CreateDeleteOperations<String> operations;

	private BaseCreateDeleteExecutor<String> executor;

	@BeforeEach
	void setUp() {
		when(operations.resourceType()).thenReturn("api_version");
		when(operations.requiredFields()).thenReturn(List.of("version"));
		when(operations.parentType()).thenReturn("api");
		when(operations.mapCreateFields(any(), anyMap())).thenReturn("request");
		executor = new BaseCreateDeleteExecutor<>(operations);
	}

	private static PlannedChange.Builder version(ActionType action) {
		return PlannedChange.builder("c1", action, "api_version")
				.resourceRef("orders-v1")
				.resourceId(action == ActionType.CREATE ? null : VERSION_ID)
				.field("version", "1.0.0");
	}

	private static ExecutionContext underApi(PlannedChange change, boolean dryRun) {
		return ExecutionContext.of(change, Map.of(), API_ID, dryRun);
	}

	@Test
	@DisplayName("exposes the parent type of its operations")
	void parentType() {
		assertThat(executor.parentType()).isEqualTo("api");
		assertThat(executor.resourceType()).isEqualTo("api_version");
	}

	@Test
	@DisplayName("creates through the operations")
	void creates() {
		when(operations.create(eq("request"), any())).thenReturn(VERSION_ID);
		PlannedChange change = version(ActionType.CREATE).build();

		assertThat(executor.create(change, ExecutionContext.of(change, false))).isEqualTo(VERSION_ID);
	}

	@Test
	@DisplayName("has no update")
	void noUpdate() {
		PlannedChange change = version(ActionType.UPDATE).build();

		assertThatThrownBy(() -> executor.update(change, ExecutionContext.of(change, false)))
				.isInstanceOf(UnsupportedChangeException.class)
				.hasMessage("update operation not yet implemented for api_version");
	}

	@Test
	@DisplayName("deletes without a lookup when the type cannot be fetched by id")
	void deletesWithoutLookup() {
		PlannedChange change = version(ActionType.DELETE).build();

		executor.delete(change, underApi(change, false));

		verify(operations).delete(eq(VERSION_ID), any());
		verify(operations, never()).getById(any(), any());
	}

	@Test
	@DisplayName("checks ownership when the type can be fetched by id")
	void checksOwnership() {
		when(operations.supportsGetById()).thenReturn(true);
		when(operations.getById(eq(VERSION_ID), any()))
				.thenReturn(ResourceInfo.of(VERSION_ID, "1.0.0", Map.of()));
		PlannedChange change = version(ActionType.DELETE).build();

		assertThatThrownBy(() -> executor.delete(change, underApi(change, false)))
				.isInstanceOf(ProtectionViolationException.class)
				.hasMessageContaining("not a KONGCTL-managed resource");
	}

	@Test
	@DisplayName("dry-run delete makes no call")
	void dryRunDelete() {
		PlannedChange change = version(ActionType.DELETE).build();

		executor.delete(change, underApi(change, true));

		verify(operations, never()).delete(any(), any());
	}

	@Test
	@DisplayName("a delete answered with not found counts as done")
	void notFoundIsDeleted() {
		doThrow(new ApiClientException("version not found", 404)).when(operations).delete(eq(VERSION_ID), any());
		PlannedChange change = version(ActionType.DELETE).build();

		executor.delete(change, underApi(change, false));

		verify(operations).delete(eq(VERSION_ID), any());
	}

	@Test
	@DisplayName("other delete failures are reported")
	void otherDeleteFailures() {
		doThrow(new ApiClientException("forbidden", 403)).when(operations).delete(eq(VERSION_ID), any());
		PlannedChange change = version(ActionType.DELETE).build();

		assertThatThrownBy(() -> executor.delete(change, underApi(change, false)))
				.isInstanceOf(ResourceApiException.class)
				.hasMessageStartingWith("API error during delete of api_version")
				.hasMessageEndingWith("forbidden");
	}

	@Test
	@DisplayName("an absent resource is already deleted")
	void absentIsDeleted() {
		when(operations.supportsGetById()).thenReturn(true);
		PlannedChange change = version(ActionType.DELETE).build();

		executor.delete(change, underApi(change, false));

		verify(operations, never()).delete(any(), any());
	}

	@Test
	@DisplayName("a child whose parent no longer exists is already deleted")
	void absentParent() {
		PlannedChange change = version(ActionType.DELETE).build();

		executor.delete(change, ExecutionContext.forDelete(change, () -> null, false));

		verify(operations, never()).delete(any(), any());
	}

	@Test
	@DisplayName("looks the parent up when the delete needs it")
	void lazyParent() {
		PlannedChange change = version(ActionType.DELETE).build();
		ExecutionContext context = ExecutionContext.forDelete(change, () -> API_ID, false);

		executor.delete(change, context);

		verify(operations).delete(VERSION_ID, context);
		assertThat(context.requireParentId()).isEqualTo(API_ID);
	}

	@Test
	@DisplayName("a protection transition lets a protected child be deleted")
	void protectedWithTransition() {
		when(operations.supportsGetById()).thenReturn(true);
		when(operations.getById(eq(VERSION_ID), any()))
				.thenReturn(ResourceInfo.of(VERSION_ID, "1.0.0", TestChanges.managedLabels(true)));
		PlannedChange protectedChange = version(ActionType.DELETE).build();
		PlannedChange unprotecting = version(ActionType.DELETE)
				.protection(Protection.transition(true, false))
				.build();

		assertThatThrownBy(() -> executor.delete(protectedChange, underApi(protectedChange, false)))
				.isInstanceOf(ProtectionViolationException.class)
				.hasMessageEndingWith("(api_version) is protected and cannot be deleted");
		executor.delete(unprotecting, underApi(unprotecting, false));

		verify(operations).delete(eq(VERSION_ID), any());
	}
}
