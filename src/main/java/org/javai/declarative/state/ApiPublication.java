package org.javai.declarative.state;

import java.util.List;

public record ApiPublication(String apiId, String portalId, String visibility, List<String> authStrategyIds) {

	public ApiPublication {
		authStrategyIds = authStrategyIds != null ? List.copyOf(authStrategyIds) : List.of();
	}
}
