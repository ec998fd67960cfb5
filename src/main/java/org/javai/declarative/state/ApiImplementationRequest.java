package org.javai.declarative.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiImplementationRequest(@JsonProperty("service") ServiceReference service) {
}
