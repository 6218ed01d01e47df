package com.signup.core;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/** Helpers that lift plain functions and collaborator calls into {@link AsyncStep}s. */
public final class Steps {
    private Steps() {}

    /** Already-successful outcome; the "carry forward" side of a gather. */
    public static <T> CompletableFuture<Outcome<T>> carry(T value) {
        return CompletableFuture.completedFuture(Outcome.success(value));
    }

    public static <T> CompletableFuture<Outcome<T>> fail(Exception failure) {
        return CompletableFuture.completedFuture(Outcome.failure(failure));
    }

    /** Synchronous fallible function; a thrown exception becomes the failure as-is. */
    public static <I, O> AsyncStep<I, O> attempt(ThrowingFn<? super I, ? extends O> fn) {
        return attempt(fn, Function.<Exception>identity());
    }

    /** Synchronous fallible function; a thrown exception is translated by {@code onError}. */
    public static <I, O> AsyncStep<I, O> attempt(ThrowingFn<? super I, ? extends O> fn,
                                                 Function<? super Exception, ? extends Exception> onError) {
        Objects.requireNonNull(fn, "fn");
        Objects.requireNonNull(onError, "onError");
        ThrowingFn<I, O> body = fn::apply;
        return body.lift(onError);
    }

    /**
     * Collaborator call returning a future. Synchronous throws and exceptional completion are both
     * translated by {@code onError}, which receives the unwrapped cause.
     */
    public static <I, O> AsyncStep<I, O> perform(Function<? super I, ? extends CompletableFuture<? extends O>> call,
                                                 Function<? super Exception, ? extends Exception> onError) {
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(onError, "onError");
        return in -> {
            CompletableFuture<? extends O> pending;
            try {
                pending = Objects.requireNonNull(call.apply(in), "collaborator returned no future");
            } catch (RuntimeException ex) {
                return CompletableFuture.completedFuture(Outcome.<O>failure(onError.apply(ex)));
            }
            return pending.handle((value, error) -> error == null
                    ? Outcome.<O>success(value)
                    : Outcome.<O>failure(onError.apply(asException(error))));
        };
    }

    /** Turns exceptional completion (or a missing outcome) into a failed {@link Outcome}. */
    public static <T> CompletableFuture<Outcome<T>> recover(CompletableFuture<? extends Outcome<T>> future) {
        Objects.requireNonNull(future, "future");
        return future.handle((outcome, error) -> {
            if (error != null) return Outcome.<T>failure(asException(error));
            if (outcome == null) return Outcome.<T>failure(new IllegalStateException("step completed without an outcome"));
            return outcome;
        });
    }

    /** Strips future wrappers. Errors are rethrown, never turned into failures. */
    static Exception asException(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof Exception) return (Exception) cause;
        if (cause instanceof Error) throw (Error) cause;
        return new IllegalStateException(cause);
    }
}
