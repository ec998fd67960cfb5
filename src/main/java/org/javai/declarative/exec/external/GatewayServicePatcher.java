package org.javai.declarative.exec.external;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.javai.declarative.adapter.ApiImplementationAdapter;
import org.javai.declarative.plan.ActionType;
import org.javai.declarative.plan.Fields;
import org.javai.declarative.plan.Plan;
import org.javai.declarative.plan.PlannedChange;
import org.javai.declarative.plan.RefPlaceholder;

/**
 * Writes a gateway service id, learned only after the external tool ran, into the
 * API implementation changes that come later in the plan and point at that service by
 * placeholder or by ref.
 * <p>
 * This is the only place where a change is modified during execution.
 */
public final class GatewayServicePatcher {

	static final String SERVICE_ID = "id";
	static final String CONTROL_PLANE_ID = "control_plane_id";

	private GatewayServicePatcher() {
	}

	/**
	 * Whether any change after {@code afterChangeId} needs the service identified by {@code gatewayRef}.
	 */
	public static boolean isNeeded(Plan plan, String afterChangeId, String gatewayRef) {
		if (StringUtils.isBlank(gatewayRef)) {
			return false;
		}
		for (PlannedChange change : laterChanges(plan, afterChangeId)) {
			if (isImplementation(change)
					&& (change.action() == ActionType.CREATE || change.action() == ActionType.UPDATE)
					&& matches(change, gatewayRef)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Patch later API implementation creates that reference {@code gatewayRef}.
	 *
	 * @return number of changes patched
	 */
	public static int patch(Plan plan, String afterChangeId, String gatewayRef, String serviceId,
			String controlPlaneId) {
		int patched = 0;
		for (PlannedChange change : laterChanges(plan, afterChangeId)) {
			if (!isImplementation(change) || change.action() != ActionType.CREATE || !matches(change, gatewayRef)) {
				continue;
			}
			Map<String, Object> service = new LinkedHashMap<>(Fields.map(change.fields(),
					ApiImplementationAdapter.SERVICE));
			service.put(SERVICE_ID, serviceId);
			if (StringUtils.isNotBlank(controlPlaneId)) {
				service.put(CONTROL_PLANE_ID, controlPlaneId);
			}
			change.patchField(ApiImplementationAdapter.SERVICE, service);
			patched++;
		}
		return patched;
	}

	private static List<PlannedChange> laterChanges(Plan plan, String afterChangeId) {
		List<String> order = plan.executionOrder();
		int position = order.indexOf(afterChangeId);
		return order.subList(position + 1, order.size()).stream()
				.map(plan::findChange)
				.filter(change -> change != null)
				.toList();
	}

	private static boolean isImplementation(PlannedChange change) {
		return ApiImplementationAdapter.TYPE.equals(change.resourceType());
	}

	private static boolean matches(PlannedChange change, String gatewayRef) {
		Map<String, Object> service = Fields.map(change.fields(), ApiImplementationAdapter.SERVICE);
		String id = Fields.string(service, SERVICE_ID);
		if (StringUtils.isBlank(id)) {
			return false;
		}
		if (RefPlaceholder.isPlaceholder(id)) {
			return RefPlaceholder.parse(id)
					.filter(placeholder -> "id".equals(placeholder.field()))
					.map(placeholder -> placeholder.ref().equals(gatewayRef))
					.orElse(false);
		}
		return id.equals(gatewayRef);
	}
}
