package org.javai.declarative.state;

import java.util.List;

/**
 * Remote resource-management API, one group of calls per resource kind.
 * <p>
 * Lookups return {@code null} when the resource does not exist. Every other failure
 * is reported as an {@link ApiClientException}. Calls are blocking; an interrupted
 * caller should see the in-flight call fail.
 */
public interface StateClient {

	// Portals

	Portal createPortal(PortalRequest request);

	Portal updatePortal(String id, PortalRequest request);

	void deletePortal(String id, boolean force);

	Portal getPortalByName(String name);

	// Control planes

	ControlPlane createControlPlane(ControlPlaneRequest request);

	ControlPlane updateControlPlane(String id, ControlPlaneRequest request);

	void deleteControlPlane(String id);

	ControlPlane getControlPlaneByName(String name);

	ControlPlane getControlPlaneById(String id);

	// APIs

	Api createApi(ApiRequest request);

	Api updateApi(String id, ApiRequest request);

	void deleteApi(String id);

	Api getApiByName(String name);

	// API versions

	ApiVersion createApiVersion(String apiId, ApiVersionRequest request);

	void deleteApiVersion(String apiId, String versionId);

	// API publications

	ApiPublication publishApi(String apiId, ApiPublicationRequest request);

	void unpublishApi(String apiId, String portalId);

	// API implementations

	ApiImplementation createApiImplementation(String apiId, ApiImplementationRequest request);

	void deleteApiImplementation(String apiId, String implementationId);

	// Application auth strategies

	AuthStrategy createAuthStrategy(AuthStrategyRequest request);

	AuthStrategy updateAuthStrategy(String id, AuthStrategyRequest request);

	void deleteAuthStrategy(String id);

	AuthStrategy getAuthStrategyByName(String name);

	// Gateway services

	List<GatewayService> listGatewayServices(String controlPlaneId);
}
