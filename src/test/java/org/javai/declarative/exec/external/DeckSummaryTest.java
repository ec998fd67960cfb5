package org.javai.declarative.exec.external;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DeckSummary")
class DeckSummaryTest {

	@Test
	@DisplayName("reads past-tense counts")
	void pastTense() {
		assertThat(DeckSummary.parse("{\"summary\":{\"created\":2,\"updated\":1,\"deleted\":0,\"total\":3}}"))
				.contains(new DeckSummary(2, 1, 0, 3));
	}

	@Test
	@DisplayName("reads progressive counts and derives the total")
	void progressive() {
		assertThat(DeckSummary.parse("{\"summary\":{\"creating\":1,\"updating\":0,\"deleting\":4}}"))
				.contains(new DeckSummary(1, 0, 4, 5));
	}

	@Test
	@DisplayName("ignores output without a summary")
	void noSummary() {
		assertThat(DeckSummary.parse("creating service users")).isEmpty();
		assertThat(DeckSummary.parse("{\"changes\":{}}")).isEmpty();
		assertThat(DeckSummary.parse("")).isEmpty();
	}
}
