package org.javai.declarative.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiPublicationRequest(
		@JsonProperty("portal_id") String portalId,
		@JsonProperty("visibility") String visibility,
		@JsonProperty("auto_approve_registrations") Boolean autoApproveRegistrations,
		@JsonProperty("auth_strategy_ids") List<String> authStrategyIds) {
}
