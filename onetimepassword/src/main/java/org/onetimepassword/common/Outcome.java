package org.onetimepassword.common;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resultado de uma operação: um valor ou um {@link GenerationError}, nunca os dois.
 */
public final class Outcome<T> {
	private final T value;
	private final GenerationError error;

	private Outcome(T value, GenerationError error) {
		this.value = value;
		this.error = error;
	}

	public static <T> Outcome<T> success(T value) {
		return new Outcome<>(Objects.requireNonNull(value, "value"), null);
	}

	public static <T> Outcome<T> failure(GenerationError error) {
		return new Outcome<>(null, Objects.requireNonNull(error, "error"));
	}

	public boolean isSuccess() {
		return error == null;
	}

	public Optional<T> value() {
		return Optional.ofNullable(value);
	}

	public Optional<GenerationError> error() {
		return Optional.ofNullable(error);
	}

	public <R> Outcome<R> map(Function<? super T, ? extends R> f) {
		return isSuccess() ? success(f.apply(value)) : failure(error);
	}

	public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> f) {
		return isSuccess() ? f.apply(value) : failure(error);
	}

	public T getOrThrow() {
		if (!isSuccess())
			throw new GenerationException(error);
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Outcome<?> other))
			return false;
		return Objects.equals(value, other.value) && error == other.error;
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, error);
	}

	@Override
	public String toString() {
		return isSuccess() ? "Success[" + value + "]" : "Failure[" + error + "]";
	}
}
