package com.signup.core;

import java.util.concurrent.CompletableFuture;

/** One fallible, possibly asynchronous unit of work: I -> O or a failure. */
@FunctionalInterface
public interface AsyncStep<I, O> {
    CompletableFuture<Outcome<O>> apply(I in);
}
