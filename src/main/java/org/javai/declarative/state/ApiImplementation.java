package org.javai.declarative.state;

public record ApiImplementation(String id, String apiId, ServiceReference service) {
}
