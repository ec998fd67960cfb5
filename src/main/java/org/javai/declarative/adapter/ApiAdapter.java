package org.javai.declarative.adapter;

import java.util.List;
import java.util.Map;
import org.javai.declarative.exec.resource.ExecutionContext;
import org.javai.declarative.exec.resource.ResourceInfo;
import org.javai.declarative.exec.resource.ResourceOperations;
import org.javai.declarative.plan.Fields;
import org.javai.declarative.state.Api;
import org.javai.declarative.state.ApiRequest;
import org.javai.declarative.state.StateClient;

public class ApiAdapter extends AbstractAdapter implements ResourceOperations<ApiRequest, ApiRequest> {

	public static final String TYPE = "api";

	public ApiAdapter(StateClient client) {
		super(client);
	}

	@Override
	public String resourceType() {
		return TYPE;
	}

	@Override
	public List<String> requiredFields() {
		return List.of(Fields.NAME);
	}

	@Override
	public ApiRequest mapCreateFields(ExecutionContext context, Map<String, Object> fields) {
		Map<String, Object> payload = payload(fields);
		payload.put(Fields.LABELS, createLabels(context, fields));
		return convert(payload, ApiRequest.class);
	}

	@Override
	public ApiRequest mapUpdateFields(ExecutionContext context, Map<String, Object> fields,
			Map<String, String> currentLabels) {
		Map<String, Object> payload = payload(fields);
		payload.put(Fields.LABELS, updateLabels(context, fields, currentLabels));
		return convert(payload, ApiRequest.class);
	}

	@Override
	public String create(ApiRequest request, ExecutionContext context) {
		return client().createApi(request).id();
	}

	@Override
	public String update(String id, ApiRequest request, ExecutionContext context) {
		return client().updateApi(id, request).id();
	}

	@Override
	public void delete(String id, ExecutionContext context) {
		client().deleteApi(id);
	}

	@Override
	public boolean checksExistenceOnCreate() {
		return hasClient();
	}

	@Override
	public ResourceInfo getByName(String name) {
		Api api = client().getApiByName(name);
		return api == null ? null : ResourceInfo.of(api.id(), api.name(), api.labels());
	}
}
