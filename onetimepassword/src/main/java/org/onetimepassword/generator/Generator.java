package org.onetimepassword.generator;

import org.onetimepassword.common.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuração validada de um gerador de senhas: fator, segredo, algoritmo e dígitos.
 * Imutável; o segredo é copiado na entrada e na saída.
 */
public final class Generator {
	private static final Logger log = LoggerFactory.getLogger(Generator.class);

	public static final Algorithm DEFAULT_ALGORITHM = Algorithm.SHA1;
	public static final int DEFAULT_DIGITS = 6;
	public static final double DEFAULT_PERIOD = 30;

	private final Factor factor;
	private final byte[] secret;
	private final Algorithm algorithm;
	private final int digits;

	private Generator(Factor factor, byte[] secret, Algorithm algorithm, int digits) {
		this.factor = factor;
		this.secret = secret.clone();
		this.algorithm = algorithm;
		this.digits = digits;
	}

	/**
	 * @return vazio se a configuração não passa em {@link ConfigurationValidator#validate}
	 */
	public static Optional<Generator> create(Factor factor, byte[] secret, Algorithm algorithm, int digits) {
		Objects.requireNonNull(factor, "factor");
		Objects.requireNonNull(secret, "secret");
		Objects.requireNonNull(algorithm, "algorithm");
		if (!ConfigurationValidator.validate(factor, secret, algorithm, digits)) {
			log.debug("Rejected generator configuration: factor={}, algorithm={}, digits={}", factor, algorithm, digits);
			return Optional.empty();
		}
		return Optional.of(new Generator(factor, secret, algorithm, digits));
	}

	public Factor factor() {
		return factor;
	}

	public byte[] secret() {
		return secret.clone();
	}

	public Algorithm algorithm() {
		return algorithm;
	}

	public int digits() {
		return digits;
	}

	public Outcome<String> password(double secondsSince1970) {
		return CounterResolver.resolveCounter(factor, secondsSince1970)
				.flatMap(counter -> PasswordGenerator.generate(algorithm, digits, secret, counter));
	}

	public Outcome<String> password(Instant time) {
		return CounterResolver.resolveCounter(factor, time)
				.flatMap(counter -> PasswordGenerator.generate(algorithm, digits, secret, counter));
	}

	/**
	 * Próximo gerador: contador + 1 para HOTP, o próprio gerador para TOTP.
	 *
	 * @throws ArithmeticException se o contador já é o maior uint64
	 */
	public Generator successor() {
		return factor.fold(
				counter -> {
					if (counter.value() == -1L)
						throw new ArithmeticException("HOTP counter overflow");
					return new Generator(Factor.counter(counter.value() + 1), secret, algorithm, digits);
				},
				timer -> this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Generator other))
			return false;
		return digits == other.digits && algorithm == other.algorithm
				&& factor.equals(other.factor) && Arrays.equals(secret, other.secret);
	}

	@Override
	public int hashCode() {
		return Objects.hash(factor, algorithm, digits, Arrays.hashCode(secret));
	}

	// segredo nunca aparece no toString
	@Override
	public String toString() {
		return "Generator[factor=" + factor + ", algorithm=" + algorithm + ", digits=" + digits + "]";
	}

	/**
	 * Builder com os padrões usuais de apps autenticadores (SHA1, 6 dígitos, 30s).
	 */
	public static final class Builder {
		private Factor factor = Factor.timer(DEFAULT_PERIOD);
		private byte[] secret;
		private Algorithm algorithm = DEFAULT_ALGORITHM;
		private int digits = DEFAULT_DIGITS;

		public Builder secret(byte[] secret) {
			this.secret = secret;
			return this;
		}

		public Builder algorithm(Algorithm algorithm) {
			this.algorithm = algorithm;
			return this;
		}

		public Builder digits(int digits) {
			this.digits = digits;
			return this;
		}

		public Builder period(double period) {
			this.factor = Factor.timer(period);
			return this;
		}

		public Builder counter(long counter) {
			this.factor = Factor.counter(counter);
			return this;
		}

		public Builder factor(Factor factor) {
			this.factor = factor;
			return this;
		}

		public Generator build() {
			if (secret == null)
				throw new IllegalArgumentException("secret is required");
			return create(factor, secret, algorithm, digits)
					.orElseThrow(() -> new IllegalArgumentException("Invalid generator configuration"));
		}
	}
}
