package org.javai.declarative.plan;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RefPlaceholder and Identifiers")
class RefPlaceholderTest {

	@Test
	@DisplayName("parses ref and field")
	void parsesRefAndField() {
		assertThat(RefPlaceholder.parse("__REF__:users-svc#id"))
				.contains(new RefPlaceholder("users-svc", "id"));
		assertThat(RefPlaceholder.parse("__REF__:cp-main#name"))
				.contains(new RefPlaceholder("cp-main", "name"));
	}

	@Test
	@DisplayName("a placeholder without a field refers to the id")
	void defaultsFieldToId() {
		assertThat(RefPlaceholder.parse("__REF__:users-svc"))
				.hasValueSatisfying(p -> assertThat(p.field()).isEqualTo("id"));
	}

	@Test
	@DisplayName("plain values and empty refs are not placeholders")
	void rejectsNonPlaceholders() {
		assertThat(RefPlaceholder.parse("users-svc")).isEmpty();
		assertThat(RefPlaceholder.parse(null)).isEmpty();
		assertThat(RefPlaceholder.parse("__REF__:#id")).isEmpty();
	}

	@Test
	@DisplayName("renders back to the wire form")
	void rendersWireForm() {
		assertThat(new RefPlaceholder("portal-a", null)).hasToString("__REF__:portal-a#id");
	}

	@Test
	@DisplayName("only real identifiers are concrete")
	void concreteIdentifiers() {
		assertThat(Identifiers.isConcrete("8a4b2d4e-1111-4c4c-9d9d-0123456789ab")).isTrue();
		assertThat(Identifiers.isConcrete("some-name")).isTrue();
		assertThat(Identifiers.isConcrete(Identifiers.UNKNOWN)).isFalse();
		assertThat(Identifiers.isConcrete("__REF__:x#id")).isFalse();
		assertThat(Identifiers.isConcrete(" ")).isFalse();
		assertThat(Identifiers.isConcrete(null)).isFalse();
	}

	@Test
	@DisplayName("UUID format is strict")
	void uuidFormat() {
		assertThat(Identifiers.isUuid("8a4b2d4e-1111-4c4c-9d9d-0123456789ab")).isTrue();
		assertThat(Identifiers.isUuid("8a4b2d4e11114c4c9d9d0123456789ab")).isFalse();
		assertThat(Identifiers.isUuid("users-svc")).isFalse();
	}
}
