package org.javai.declarative.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A gateway service an API implementation points at.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServiceReference(
		@JsonProperty("id") String id,
		@JsonProperty("control_plane_id") String controlPlaneId) {
}
