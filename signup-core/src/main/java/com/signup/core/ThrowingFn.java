package com.signup.core;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/** Synchronous step body that may throw; see {@link Steps#attempt}. */
@FunctionalInterface
public interface ThrowingFn<I, O> {
    O apply(I in) throws Exception;

    /** Lifts this body into an already-completed {@link AsyncStep}, translating what it throws. */
    default AsyncStep<I, O> lift(Function<? super Exception, ? extends Exception> onError) {
        return in -> {
            try {
                return CompletableFuture.completedFuture(Outcome.success(apply(in)));
            } catch (Exception ex) {
                return CompletableFuture.completedFuture(Outcome.<O>failure(onError.apply(ex)));
            }
        };
    }
}
