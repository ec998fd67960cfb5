package org.javai.declarative.adapter;

import java.util.List;
import java.util.Map;
import org.javai.declarative.exec.resource.ExecutionContext;
import org.javai.declarative.exec.resource.ResourceInfo;
import org.javai.declarative.exec.resource.ResourceOperations;
import org.javai.declarative.plan.Fields;
import org.javai.declarative.state.AuthStrategy;
import org.javai.declarative.state.AuthStrategyRequest;
import org.javai.declarative.state.StateClient;

/**
 * Application auth strategies (key-auth, openid-connect) used by portals and publications.
 */
public class AuthStrategyAdapter extends AbstractAdapter
		implements ResourceOperations<AuthStrategyRequest, AuthStrategyRequest> {

	public static final String TYPE = "application_auth_strategy";
	static final String STRATEGY_TYPE = "strategy_type";

	public AuthStrategyAdapter(StateClient client) {
		super(client);
	}

	@Override
	public String resourceType() {
		return TYPE;
	}

	@Override
	public List<String> requiredFields() {
		return List.of(Fields.NAME, STRATEGY_TYPE);
	}

	@Override
	public AuthStrategyRequest mapCreateFields(ExecutionContext context, Map<String, Object> fields) {
		Map<String, Object> payload = payload(fields);
		payload.put(Fields.LABELS, createLabels(context, fields));
		return convert(payload, AuthStrategyRequest.class);
	}

	@Override
	public AuthStrategyRequest mapUpdateFields(ExecutionContext context, Map<String, Object> fields,
			Map<String, String> currentLabels) {
		Map<String, Object> payload = payload(fields);
		// the strategy type cannot change after creation
		payload.remove(STRATEGY_TYPE);
		payload.put(Fields.LABELS, updateLabels(context, fields, currentLabels));
		return convert(payload, AuthStrategyRequest.class);
	}

	@Override
	public String create(AuthStrategyRequest request, ExecutionContext context) {
		return client().createAuthStrategy(request).id();
	}

	@Override
	public String update(String id, AuthStrategyRequest request, ExecutionContext context) {
		return client().updateAuthStrategy(id, request).id();
	}

	@Override
	public void delete(String id, ExecutionContext context) {
		client().deleteAuthStrategy(id);
	}

	@Override
	public ResourceInfo getByName(String name) {
		AuthStrategy strategy = client().getAuthStrategyByName(name);
		return strategy == null ? null : ResourceInfo.of(strategy.id(), strategy.name(), strategy.labels());
	}
}
