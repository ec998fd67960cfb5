package org.javai.declarative.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiRequest(
		@JsonProperty("name") String name,
		@JsonProperty("description") String description,
		@JsonProperty("version") String version,
		@JsonProperty("slug") String slug,
		@JsonProperty("labels") Map<String, String> labels) {
}
