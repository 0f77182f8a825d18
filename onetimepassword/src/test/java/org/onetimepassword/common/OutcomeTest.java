package org.onetimepassword.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("[Common] Outcome")
class OutcomeTest {

	@Test
	@DisplayName("success: carrega o valor e nenhum erro")
	void success_carries_value() {
		Outcome<String> o = Outcome.success("ok");

		assertThat(o.isSuccess()).isTrue();
		assertThat(o.value()).contains("ok");
		assertThat(o.error()).isEmpty();
		assertThat(o.getOrThrow()).isEqualTo("ok");
	}

	@Test
	@DisplayName("failure: getOrThrow → GenerationException com o mesmo erro")
	void failure_throws_on_get() {
		Outcome<String> o = Outcome.failure(GenerationError.INVALID_DIGITS);

		assertThat(o.isSuccess()).isFalse();
		assertThat(o.value()).isEmpty();
		assertThat(o.error()).contains(GenerationError.INVALID_DIGITS);
		assertThatThrownBy(o::getOrThrow)
				.isInstanceOfSatisfying(GenerationException.class,
						e -> assertThat(e.getError()).isEqualTo(GenerationError.INVALID_DIGITS));
	}

	@Test
	@DisplayName("map/flatMap: falha se propaga sem chamar a função")
	void failure_short_circuits() {
		Outcome<Long> failed = Outcome.failure(GenerationError.INVALID_TIME);

		Outcome<String> mapped = failed.map(v -> {
			throw new AssertionError("must not be called");
		});

		assertThat(mapped).isEqualTo(Outcome.failure(GenerationError.INVALID_TIME));
		assertThat(Outcome.success(2L).flatMap(v -> Outcome.success(v * 2))).isEqualTo(Outcome.success(4L));
	}
}
