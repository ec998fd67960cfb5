package org.javai.declarative.adapter;

import java.util.List;
import org.javai.declarative.exec.resource.BaseCreateDeleteExecutor;
import org.javai.declarative.exec.resource.BaseExecutor;
import org.javai.declarative.exec.resource.ResourceExecutor;
import org.javai.declarative.state.StateClient;

/**
 * Executors for every supported resource type, backed by one client.
 */
public final class DefaultResourceExecutors {

	private DefaultResourceExecutors() {
	}

	/**
	 * @param client the remote API client; may be {@code null}, in which case any remote
	 * call fails the change that needs it
	 */
	public static List<ResourceExecutor> create(StateClient client) {
		return List.of(
				new BaseExecutor<>(new PortalAdapter(client)),
				new BaseExecutor<>(new ControlPlaneAdapter(client)),
				new BaseExecutor<>(new ApiAdapter(client)),
				new BaseExecutor<>(new AuthStrategyAdapter(client)),
				new BaseCreateDeleteExecutor<>(new ApiVersionAdapter(client)),
				new BaseCreateDeleteExecutor<>(new ApiPublicationAdapter(client)),
				new BaseCreateDeleteExecutor<>(new ApiImplementationAdapter(client)));
	}
}
