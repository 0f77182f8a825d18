package org.onetimepassword.generator;

import java.util.function.Function;

/**
 * Origem do contador: valor explícito (HOTP) ou período em segundos (TOTP).
 */
public sealed interface Factor permits Factor.Counter, Factor.Timer {

	<R> R fold(Function<Counter, R> onCounter, Function<Timer, R> onTimer);

	static Counter counter(long value) {
		return new Counter(value);
	}

	static Timer timer(double period) {
		return new Timer(period);
	}

	/**
	 * @param value contador de 64 bits, interpretado sem sinal
	 */
	record Counter(long value) implements Factor {
		@Override
		public <R> R fold(Function<Counter, R> onCounter, Function<Timer, R> onTimer) {
			return onCounter.apply(this);
		}

		@Override
		public String toString() {
			return "Counter[" + Long.toUnsignedString(value) + "]";
		}
	}

	record Timer(double period) implements Factor {
		@Override
		public <R> R fold(Function<Counter, R> onCounter, Function<Timer, R> onTimer) {
			return onTimer.apply(this);
		}
	}
}
