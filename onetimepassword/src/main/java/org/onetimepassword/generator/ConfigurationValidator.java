package org.onetimepassword.generator;

/**
 * Checagem consultiva de uma configuração "sã". Não gera nada, só responde.
 */
public final class ConfigurationValidator {
	public static final int MIN_DIGITS = 6;
	public static final int MAX_DIGITS = 8;
	public static final double MAX_PERIOD = 300;

	private ConfigurationValidator() {
	}

	public static boolean validate(Factor factor, byte[] secret, Algorithm algorithm, int digits) {
		boolean validDigits = MIN_DIGITS <= digits && digits <= MAX_DIGITS;
		return factor.fold(
				counter -> validDigits,
				timer -> validDigits && isValidPeriod(timer.period()));
	}

	// NaN falha nas duas comparações
	static boolean isValidPeriod(double period) {
		return 0 < period && period <= MAX_PERIOD;
	}
}
