package org.javai.declarative.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Create or update payload for a portal. Null members are left unchanged on update.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PortalRequest(
		@JsonProperty("name") String name,
		@JsonProperty("display_name") String displayName,
		@JsonProperty("description") String description,
		@JsonProperty("authentication_enabled") Boolean authenticationEnabled,
		@JsonProperty("rbac_enabled") Boolean rbacEnabled,
		@JsonProperty("auto_approve_developers") Boolean autoApproveDevelopers,
		@JsonProperty("auto_approve_applications") Boolean autoApproveApplications,
		@JsonProperty("default_application_auth_strategy_id") String defaultApplicationAuthStrategyId,
		@JsonProperty("labels") Map<String, String> labels) {
}
