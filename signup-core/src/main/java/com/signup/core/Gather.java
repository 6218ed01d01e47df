package com.signup.core;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;

/**
 * Joins independent steps that are already running.
 * <p>
 * Every part is awaited; results are combined in declared order, regardless of completion order.
 * When several parts fail, the failure of the earliest declared part is reported.
 */
public final class Gather {
    private Gather() {}

    @FunctionalInterface
    public interface Combiner3<A, B, C, R> {
        R apply(A a, B b, C c);
    }

    public static <A, B, R> CompletableFuture<Outcome<R>> both(CompletableFuture<Outcome<A>> first,
                                                               CompletableFuture<Outcome<B>> second,
                                                               BiFunction<? super A, ? super B, ? extends R> combine) {
        Objects.requireNonNull(combine, "combine");
        var a = Steps.recover(Objects.requireNonNull(first, "first"));
        var b = Steps.recover(Objects.requireNonNull(second, "second"));
        return CompletableFuture.allOf(a, b).thenApply(ignored -> {
            Outcome<A> oa = a.join();
            Outcome<B> ob = b.join();
            if (oa.isFailure()) return Outcome.<R>failure(oa.failure());
            if (ob.isFailure()) return Outcome.<R>failure(ob.failure());
            return combined(() -> combine.apply(oa.value(), ob.value()));
        });
    }

    public static <A, B, C, R> CompletableFuture<Outcome<R>> all(CompletableFuture<Outcome<A>> first,
                                                                 CompletableFuture<Outcome<B>> second,
                                                                 CompletableFuture<Outcome<C>> third,
                                                                 Combiner3<? super A, ? super B, ? super C, ? extends R> combine) {
        Objects.requireNonNull(combine, "combine");
        var a = Steps.recover(Objects.requireNonNull(first, "first"));
        var b = Steps.recover(Objects.requireNonNull(second, "second"));
        var c = Steps.recover(Objects.requireNonNull(third, "third"));
        return CompletableFuture.allOf(a, b, c).thenApply(ignored -> {
            Outcome<A> oa = a.join();
            Outcome<B> ob = b.join();
            Outcome<C> oc = c.join();
            if (oa.isFailure()) return Outcome.<R>failure(oa.failure());
            if (ob.isFailure()) return Outcome.<R>failure(ob.failure());
            if (oc.isFailure()) return Outcome.<R>failure(oc.failure());
            return combined(() -> combine.apply(oa.value(), ob.value(), oc.value()));
        });
    }

    private interface Combination<R> {
        R get();
    }

    private static <R> Outcome<R> combined(Combination<? extends R> combination) {
        try {
            return Outcome.success(combination.get());
        } catch (RuntimeException ex) {
            return Outcome.failure(ex);
        }
    }
}
