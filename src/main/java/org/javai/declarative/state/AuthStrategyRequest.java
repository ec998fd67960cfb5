package org.javai.declarative.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthStrategyRequest(
		@JsonProperty("name") String name,
		@JsonProperty("display_name") String displayName,
		@JsonProperty("strategy_type") String strategyType,
		@JsonProperty("configs") Map<String, Object> configs,
		@JsonProperty("labels") Map<String, String> labels) {
}
