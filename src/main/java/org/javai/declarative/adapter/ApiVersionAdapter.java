package org.javai.declarative.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.List;
import java.util.Map;
import org.javai.declarative.exec.ChangeValidationException;
import org.javai.declarative.exec.resource.CreateDeleteOperations;
import org.javai.declarative.exec.resource.ExecutionContext;
import org.javai.declarative.state.ApiVersionRequest;
import org.javai.declarative.state.StateClient;

/**
 * Versions of an API. Versions are immutable: a changed version is deleted and recreated.
 */
public class ApiVersionAdapter extends AbstractAdapter implements CreateDeleteOperations<ApiVersionRequest> {

	public static final String TYPE = "api_version";
	static final String SPEC = "spec";

	public ApiVersionAdapter(StateClient client) {
		super(client);
	}

	@Override
	public String resourceType() {
		return TYPE;
	}

	@Override
	public List<String> requiredFields() {
		return List.of("version");
	}

	@Override
	public String parentType() {
		return ApiAdapter.TYPE;
	}

	@Override
	public ApiVersionRequest mapCreateFields(ExecutionContext context, Map<String, Object> fields) {
		Map<String, Object> payload = payload(fields);
		Object spec = payload.get(SPEC);
		if (spec != null && !(spec instanceof String)) {
			try {
				payload.put(SPEC, mapper.writeValueAsString(spec));
			} catch (JsonProcessingException e) {
				throw new ChangeValidationException("invalid spec content for api_version: " + e.getMessage(), e);
			}
		}
		return convert(payload, ApiVersionRequest.class);
	}

	@Override
	public String create(ApiVersionRequest request, ExecutionContext context) {
		return client().createApiVersion(context.requireParentId(), request).id();
	}

	@Override
	public void delete(String id, ExecutionContext context) {
		client().deleteApiVersion(context.requireParentId(), id);
	}
}
