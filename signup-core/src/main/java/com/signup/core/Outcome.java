package com.signup.core;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Terminal or intermediate result of a step: exactly one of a success value or a failure.
 * <p>
 * The failure is carried as an opaque {@link Exception}; nothing in this package inspects it.
 * A success value may be {@code null} for steps that produce nothing (void).
 */
public final class Outcome<T> {
    private final T value;
    private final Exception failure;

    private Outcome(T value, Exception failure) {
        this.value = value;
        this.failure = failure;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> failure(Exception failure) {
        return new Outcome<>(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isSuccess() { return failure == null; }
    public boolean isFailure() { return failure != null; }

    /** Success value; throws if this outcome is a failure. */
    public T value() {
        if (failure != null) throw new IllegalStateException("Outcome is a failure", failure);
        return value;
    }

    /** Failure; throws if this outcome is a success. */
    public Exception failure() {
        if (failure == null) throw new IllegalStateException("Outcome is a success");
        return failure;
    }

    public Optional<Exception> failureIfAny() {
        return Optional.ofNullable(failure);
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> fn) {
        if (failure != null) return retype();
        return success(fn.apply(value));
    }

    public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> fn) {
        if (failure != null) return retype();
        return Objects.requireNonNull(fn.apply(value), "flatMap returned null");
    }

    @SuppressWarnings("unchecked")
    private <R> Outcome<R> retype() {
        return (Outcome<R>) this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Outcome)) return false;
        Outcome<?> other = (Outcome<?>) o;
        return Objects.equals(value, other.value) && Objects.equals(failure, other.failure);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, failure);
    }

    @Override
    public String toString() {
        return failure == null ? "Success[" + value + "]" : "Failure[" + failure + "]";
    }
}
