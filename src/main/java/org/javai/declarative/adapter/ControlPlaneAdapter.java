package org.javai.declarative.adapter;

import java.util.List;
import java.util.Map;
import org.javai.declarative.exec.resource.ExecutionContext;
import org.javai.declarative.exec.resource.ResourceInfo;
import org.javai.declarative.exec.resource.ResourceOperations;
import org.javai.declarative.plan.Fields;
import org.javai.declarative.state.ControlPlane;
import org.javai.declarative.state.ControlPlaneRequest;
import org.javai.declarative.state.StateClient;

/**
 * Gateway control planes.
 */
public class ControlPlaneAdapter extends AbstractAdapter
		implements ResourceOperations<ControlPlaneRequest, ControlPlaneRequest> {

	public static final String TYPE = "control_plane";

	public ControlPlaneAdapter(StateClient client) {
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
	public ControlPlaneRequest mapCreateFields(ExecutionContext context, Map<String, Object> fields) {
		Map<String, Object> payload = payload(fields);
		payload.put(Fields.LABELS, createLabels(context, fields));
		return convert(payload, ControlPlaneRequest.class);
	}

	@Override
	public ControlPlaneRequest mapUpdateFields(ExecutionContext context, Map<String, Object> fields,
			Map<String, String> currentLabels) {
		Map<String, Object> payload = payload(fields);
		// cluster type is fixed at creation
		payload.remove("cluster_type");
		payload.put(Fields.LABELS, updateLabels(context, fields, currentLabels));
		return convert(payload, ControlPlaneRequest.class);
	}

	@Override
	public String create(ControlPlaneRequest request, ExecutionContext context) {
		return client().createControlPlane(request).id();
	}

	@Override
	public String update(String id, ControlPlaneRequest request, ExecutionContext context) {
		return client().updateControlPlane(id, request).id();
	}

	@Override
	public void delete(String id, ExecutionContext context) {
		client().deleteControlPlane(id);
	}

	@Override
	public ResourceInfo getByName(String name) {
		ControlPlane controlPlane = client().getControlPlaneByName(name);
		return controlPlane == null
				? null
				: ResourceInfo.of(controlPlane.id(), controlPlane.name(), controlPlane.labels());
	}
}
