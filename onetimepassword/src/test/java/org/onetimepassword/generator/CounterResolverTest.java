package org.onetimepassword.generator;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.onetimepassword.common.GenerationError;
import org.onetimepassword.common.Outcome;

@DisplayName("[Generator] CounterResolver")
class CounterResolverTest {

	@ParameterizedTest
	@ValueSource(doubles = {-100, 0, 59, 1e12, Double.NaN})
	@DisplayName("counter: devolve o valor sem alteração, ignorando o tempo")
	void counter_is_returned_unchanged(double atTime) {
		assertThat(CounterResolver.resolveCounter(Factor.counter(42), atTime)).isEqualTo(Outcome.success(42L));
		assertThat(CounterResolver.resolveCounter(Factor.counter(-1L), atTime)).isEqualTo(Outcome.success(-1L));
	}

	@Test
	@DisplayName("timer: floor(tempo / período)")
	void timer_divides_time() {
		assertThat(CounterResolver.resolveCounter(Factor.timer(30), 0)).isEqualTo(Outcome.success(0L));
		assertThat(CounterResolver.resolveCounter(Factor.timer(30), 59)).isEqualTo(Outcome.success(1L));
		assertThat(CounterResolver.resolveCounter(Factor.timer(30), 60)).isEqualTo(Outcome.success(2L));
		assertThat(CounterResolver.resolveCounter(Factor.timer(30), 59.999)).isEqualTo(Outcome.success(1L));
		assertThat(CounterResolver.resolveCounter(Factor.timer(30), 1111111109)).isEqualTo(Outcome.success(37037036L));
		assertThat(CounterResolver.resolveCounter(Factor.timer(0.5), 2.4)).isEqualTo(Outcome.success(4L));
	}

	@ParameterizedTest
	@ValueSource(doubles = {-0.001, -1, -1e9, Double.NEGATIVE_INFINITY, Double.NaN})
	@DisplayName("timer: tempo negativo → INVALID_TIME")
	void negative_time_fails(double atTime) {
		assertThat(CounterResolver.resolveCounter(Factor.timer(30), atTime))
				.isEqualTo(Outcome.failure(GenerationError.INVALID_TIME));
	}

	@ParameterizedTest
	@ValueSource(doubles = {0, -0.0, -30, Double.NaN})
	@DisplayName("timer: período <= 0 → INVALID_PERIOD")
	void non_positive_period_fails(double period) {
		assertThat(CounterResolver.resolveCounter(Factor.timer(period), 100))
				.isEqualTo(Outcome.failure(GenerationError.INVALID_PERIOD));
	}

	@Test
	@DisplayName("timer: tempo é checado antes do período")
	void time_is_checked_first() {
		assertThat(CounterResolver.resolveCounter(Factor.timer(0), -1))
				.isEqualTo(Outcome.failure(GenerationError.INVALID_TIME));
	}

	@Test
	@DisplayName("timer(Instant): floor exato, sem arredondar nanossegundos")
	void instant_floor_is_exact() {
		assertThat(CounterResolver.resolveCounter(Factor.timer(30), Instant.ofEpochSecond(1_700_000_009L, 999_999_999)))
				.isEqualTo(Outcome.success(56_666_666L));
		assertThat(CounterResolver.resolveCounter(Factor.timer(30), Instant.ofEpochSecond(1_700_000_010L)))
				.isEqualTo(Outcome.success(56_666_667L));
		assertThat(CounterResolver.resolveCounter(Factor.timer(30), Instant.ofEpochSecond(59, 999_999_999)))
				.isEqualTo(Outcome.success(1L));
		assertThat(CounterResolver.resolveCounter(Factor.counter(7), Instant.ofEpochSecond(-5)))
				.isEqualTo(Outcome.success(7L));
	}

	@Test
	@DisplayName("timer(Instant): antes de 1970 → INVALID_TIME; período <= 0 → INVALID_PERIOD")
	void instant_failures() {
		assertThat(CounterResolver.resolveCounter(Factor.timer(30), Instant.ofEpochSecond(-1, 500_000_000)))
				.isEqualTo(Outcome.failure(GenerationError.INVALID_TIME));
		assertThat(CounterResolver.resolveCounter(Factor.timer(0), Instant.ofEpochSecond(100)))
				.isEqualTo(Outcome.failure(GenerationError.INVALID_PERIOD));
		assertThat(CounterResolver.resolveCounter(Factor.timer(0), Instant.ofEpochSecond(-100)))
				.isEqualTo(Outcome.failure(GenerationError.INVALID_TIME));
	}

	@Test
	@DisplayName("timer: contador acima de 2^63 mantém bits sem sinal; >= 2^64 ou infinito → INVALID_TIME")
	void unsigned_range() {
		Outcome<Long> big = CounterResolver.resolveCounter(Factor.timer(1), 0x1p63);
		assertThat(big).isEqualTo(Outcome.success(Long.MIN_VALUE));
		assertThat(Long.toUnsignedString(big.getOrThrow())).isEqualTo("9223372036854775808");

		assertThat(CounterResolver.resolveCounter(Factor.timer(1), 0x1p64))
				.isEqualTo(Outcome.failure(GenerationError.INVALID_TIME));
		assertThat(CounterResolver.resolveCounter(Factor.timer(30), Double.POSITIVE_INFINITY))
				.isEqualTo(Outcome.failure(GenerationError.INVALID_TIME));
	}
}
