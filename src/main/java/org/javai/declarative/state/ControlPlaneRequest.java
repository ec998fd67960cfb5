package org.javai.declarative.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ControlPlaneRequest(
		@JsonProperty("name") String name,
		@JsonProperty("description") String description,
		@JsonProperty("cluster_type") String clusterType,
		@JsonProperty("auth_type") String authType,
		@JsonProperty("cloud_gateway") Boolean cloudGateway,
		@JsonProperty("labels") Map<String, String> labels) {
}
