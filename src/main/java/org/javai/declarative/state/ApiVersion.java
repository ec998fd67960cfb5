package org.javai.declarative.state;

public record ApiVersion(String id, String apiId, String version) {
}
