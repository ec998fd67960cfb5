package org.javai.declarative.adapter;

import java.util.List;
import java.util.Map;
import org.javai.declarative.exec.resource.ExecutionContext;
import org.javai.declarative.exec.resource.ResourceInfo;
import org.javai.declarative.exec.resource.ResourceOperations;
import org.javai.declarative.plan.Fields;
import org.javai.declarative.state.Portal;
import org.javai.declarative.state.PortalRequest;
import org.javai.declarative.state.StateClient;

/**
 * Developer portals.
 */
public class PortalAdapter extends AbstractAdapter implements ResourceOperations<PortalRequest, PortalRequest> {

	public static final String TYPE = "portal";
	static final String AUTH_STRATEGY_ID = "default_application_auth_strategy_id";

	public PortalAdapter(StateClient client) {
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
	public Map<String, String> referenceFields() {
		return Map.of(AUTH_STRATEGY_ID, AuthStrategyAdapter.TYPE);
	}

	@Override
	public PortalRequest mapCreateFields(ExecutionContext context, Map<String, Object> fields) {
		Map<String, Object> payload = payload(fields);
		payload.put(Fields.LABELS, createLabels(context, fields));
		putResolved(context, payload);
		return convert(payload, PortalRequest.class);
	}

	@Override
	public PortalRequest mapUpdateFields(ExecutionContext context, Map<String, Object> fields,
			Map<String, String> currentLabels) {
		Map<String, Object> payload = payload(fields);
		payload.put(Fields.LABELS, updateLabels(context, fields, currentLabels));
		putResolved(context, payload);
		return convert(payload, PortalRequest.class);
	}

	@Override
	public String create(PortalRequest request, ExecutionContext context) {
		return client().createPortal(request).id();
	}

	@Override
	public String update(String id, PortalRequest request, ExecutionContext context) {
		return client().updatePortal(id, request).id();
	}

	@Override
	public void delete(String id, ExecutionContext context) {
		client().deletePortal(id, true);
	}

	@Override
	public boolean checksExistenceOnCreate() {
		return hasClient();
	}

	@Override
	public ResourceInfo getByName(String name) {
		Portal portal = client().getPortalByName(name);
		return portal == null ? null : ResourceInfo.of(portal.id(), portal.name(), portal.labels());
	}

	private static void putResolved(ExecutionContext context, Map<String, Object> payload) {
		String strategyId = context.reference(AUTH_STRATEGY_ID);
		if (strategyId != null) {
			payload.put(AUTH_STRATEGY_ID, strategyId);
		}
	}
}
