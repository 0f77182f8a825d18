package org.onetimepassword.generator;

import org.onetimepassword.common.GenerationError;
import org.onetimepassword.common.Outcome;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

public final class CounterResolver {
	private static final double TWO_POW_63 = 0x1p63;
	private static final double TWO_POW_64 = 0x1p64;
	private static final BigDecimal UINT64_LIMIT = new BigDecimal(TWO_POW_64);

	private CounterResolver() {
	}

	/**
	 * Deriva o contador de 64 bits (sem sinal) a partir do fator.
	 *
	 * @param atTime segundos desde 1970; ignorado para {@link Factor.Counter}
	 */
	public static Outcome<Long> resolveCounter(Factor factor, double atTime) {
		return factor.fold(
				counter -> Outcome.success(counter.value()),
				timer -> fromTime(timer.period(), atTime));
	}

	/**
	 * Igual a {@link #resolveCounter(Factor, double)}, mas sem arredondar os nanossegundos:
	 * o floor é calculado em decimal exato.
	 */
	public static Outcome<Long> resolveCounter(Factor factor, Instant atTime) {
		return factor.fold(
				counter -> Outcome.success(counter.value()),
				timer -> fromInstant(timer.period(), atTime));
	}

	private static Outcome<Long> fromInstant(double period, Instant atTime) {
		if (atTime.getEpochSecond() < 0)
			return Outcome.failure(GenerationError.INVALID_TIME);
		if (!(period > 0))
			return Outcome.failure(GenerationError.INVALID_PERIOD);
		if (Double.isInfinite(period))
			return Outcome.success(0L);

		BigDecimal seconds = BigDecimal.valueOf(atTime.getEpochSecond()).add(BigDecimal.valueOf(atTime.getNano(), 9));
		BigDecimal steps = seconds.divide(new BigDecimal(period), 0, RoundingMode.FLOOR);
		if (steps.compareTo(UINT64_LIMIT) >= 0)
			return Outcome.failure(GenerationError.INVALID_TIME);
		return Outcome.success(steps.toBigInteger().longValue());
	}

	private static Outcome<Long> fromTime(double period, double atTime) {
		if (!(atTime >= 0))
			return Outcome.failure(GenerationError.INVALID_TIME);
		if (!(period > 0))
			return Outcome.failure(GenerationError.INVALID_PERIOD);

		double steps = Math.floor(atTime / period);
		if (steps >= TWO_POW_64) // inclui infinito
			return Outcome.failure(GenerationError.INVALID_TIME);
		if (steps < TWO_POW_63)
			return Outcome.success((long) steps);
		// [2^63, 2^64): mantém o padrão de bits sem sinal
		return Outcome.success(new BigDecimal(steps).toBigInteger().longValue());
	}
}
