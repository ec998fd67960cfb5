package org.javai.declarative.adapter;

import java.util.List;
import java.util.Map;
import org.javai.declarative.exec.ChangeValidationException;
import org.javai.declarative.exec.ReferenceResolutionException;
import org.javai.declarative.exec.resource.CreateDeleteOperations;
import org.javai.declarative.exec.resource.ExecutionContext;
import org.javai.declarative.plan.Identifiers;
import org.javai.declarative.plan.RefPlaceholder;
import org.javai.declarative.state.ApiImplementationRequest;
import org.javai.declarative.state.ServiceReference;
import org.javai.declarative.state.StateClient;

/**
 * Links an API to the gateway service implementing it.
 * <p>
 * The service id may be a placeholder at plan time when the service is created by an
 * external-tool step earlier in the same plan; by the time this change runs it must have
 * been patched to a concrete identifier. A dry-run accepts the placeholder, since the
 * external tool does not run then.
 */
public class ApiImplementationAdapter extends AbstractAdapter
		implements CreateDeleteOperations<ApiImplementationRequest> {

	public static final String TYPE = "api_implementation";
	public static final String SERVICE = "service";

	public ApiImplementationAdapter(StateClient client) {
		super(client);
	}

	@Override
	public String resourceType() {
		return TYPE;
	}

	@Override
	public List<String> requiredFields() {
		return List.of(SERVICE);
	}

	@Override
	public String parentType() {
		return ApiAdapter.TYPE;
	}

	@Override
	public ApiImplementationRequest mapCreateFields(ExecutionContext context, Map<String, Object> fields) {
		ApiImplementationRequest request = convert(payload(fields), ApiImplementationRequest.class);
		ServiceReference service = request.service();
		if (service == null) {
			throw new ChangeValidationException("api_implementation requires a service");
		}
		if (context.dryRun() && RefPlaceholder.isPlaceholder(service.id())) {
			return request;
		}
		if (!Identifiers.isUuid(service.id())) {
			throw new ReferenceResolutionException(
					"gateway service id '%s' for api_implementation is not resolved".formatted(service.id()));
		}
		if (!Identifiers.isUuid(service.controlPlaneId())) {
			throw new ReferenceResolutionException(
					"control plane id '%s' for api_implementation is not resolved".formatted(
							service.controlPlaneId()));
		}
		return request;
	}

	@Override
	public String create(ApiImplementationRequest request, ExecutionContext context) {
		return client().createApiImplementation(context.requireParentId(), request).id();
	}

	@Override
	public void delete(String id, ExecutionContext context) {
		client().deleteApiImplementation(context.requireParentId(), id);
	}
}
