package org.javai.declarative.adapter;

import java.util.List;
import java.util.Map;
import org.javai.declarative.exec.resource.CreateDeleteOperations;
import org.javai.declarative.exec.resource.ExecutionContext;
import org.javai.declarative.state.ApiPublicationRequest;
import org.javai.declarative.state.StateClient;

/**
 * Publication of an API to a portal. The publication is identified by the portal id.
 */
public class ApiPublicationAdapter extends AbstractAdapter implements CreateDeleteOperations<ApiPublicationRequest> {

	public static final String TYPE = "api_publication";
	static final String PORTAL_ID = "portal_id";

	public ApiPublicationAdapter(StateClient client) {
		super(client);
	}

	@Override
	public String resourceType() {
		return TYPE;
	}

	@Override
	public List<String> requiredFields() {
		return List.of(PORTAL_ID);
	}

	@Override
	public Map<String, String> referenceFields() {
		return Map.of(PORTAL_ID, PortalAdapter.TYPE);
	}

	@Override
	public String parentType() {
		return ApiAdapter.TYPE;
	}

	@Override
	public ApiPublicationRequest mapCreateFields(ExecutionContext context, Map<String, Object> fields) {
		Map<String, Object> payload = payload(fields);
		payload.put(PORTAL_ID, context.requireReference(PORTAL_ID));
		return convert(payload, ApiPublicationRequest.class);
	}

	@Override
	public String create(ApiPublicationRequest request, ExecutionContext context) {
		client().publishApi(context.requireParentId(), request);
		return request.portalId();
	}

	@Override
	public void delete(String id, ExecutionContext context) {
		client().unpublishApi(context.requireParentId(), id);
	}
}
