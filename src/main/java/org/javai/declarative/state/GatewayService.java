package org.javai.declarative.state;

public record GatewayService(String id, String name, String controlPlaneId) {
}
