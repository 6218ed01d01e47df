package com.signup.core;

import com.signup.metrics.MetricsRecorder;
import com.signup.metrics.SimpleMetricsRecorder;
import org.slf4j.event.Level;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Ordered chain of asynchronous fallible steps with railway semantics.
 * <ul>
 *   <li>each step receives the success value of the previous one</li>
 *   <li>the first failure ends the run; later steps are never invoked</li>
 *   <li>the failure reaches the caller unchanged</li>
 * </ul>
 * Instances are immutable and hold no per-run state, so one pipe can serve concurrent runs.
 */
public final class Pipe<I, O> {
    private final String name;
    private final List<Stage> stages;
    private final StepLogger stepLogger;
    private final MetricsRecorder recorder;

    private Pipe(String name, List<Stage> stages, StepLogger stepLogger, MetricsRecorder recorder) {
        this.name = name;
        this.stages = List.copyOf(stages);
        this.stepLogger = StepLogger.guarded(stepLogger);
        this.recorder = MetricsRecorder.guarded(recorder);
    }

    /** Start a typed builder; the carried type equals the input type until the first step. */
    public static <I> Builder<I, I> named(String name) {
        return new Builder<>(name);
    }

    /** Builder tracks both the original input type I and the current carried type C. */
    public static final class Builder<I, C> {
        private final String name;
        private final List<Stage> stages = new ArrayList<>();
        private StepLogger stepLogger = (level, tag, details) -> { };
        private MetricsRecorder recorder;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder<I, C> logger(StepLogger stepLogger) {
            this.stepLogger = Objects.requireNonNull(stepLogger, "stepLogger");
            return this;
        }

        public Builder<I, C> recorder(MetricsRecorder recorder) {
            this.recorder = Objects.requireNonNull(recorder, "recorder");
            return this;
        }

        /** Append a step turning the carried C into M; {@code tag} names it in logs and metrics. */
        @SuppressWarnings("unchecked")
        public <M> Builder<I, M> step(String tag, AsyncStep<? super C, M> step) {
            if (tag == null || tag.isBlank()) throw new IllegalArgumentException("step tag must be non-empty");
            Objects.requireNonNull(step, "step");
            stages.add(new Stage(tag, (AsyncStep<Object, Object>) (AsyncStep<?, ?>) step));
            return (Builder<I, M>) this;
        }

        public Pipe<I, C> build() {
            if (stages.isEmpty()) throw new IllegalStateException("Pipe '" + name + "' has no steps");
            return new Pipe<>(name, stages, stepLogger, recorder != null ? recorder : new SimpleMetricsRecorder());
        }
    }

    public String name() { return name; }
    public int size() { return stages.size(); }

    public List<String> tags() {
        List<String> tags = new ArrayList<>(stages.size());
        for (var s : stages) tags.add(s.tag());
        return tags;
    }

    /**
     * Runs all steps; the returned future always completes normally with an {@link Outcome}.
     * Failing loggers and recorders are reported and otherwise ignored.
     */
    @SuppressWarnings("unchecked")
    public CompletableFuture<Outcome<O>> run(I in) {
        return runFrom(0, in).thenApply(outcome -> (Outcome<O>) (Outcome<?>) outcome);
    }

    private CompletableFuture<Outcome<Object>> runFrom(int index, Object current) {
        if (index == stages.size()) return CompletableFuture.completedFuture(Outcome.success(current));

        Stage stage = stages.get(index);
        String stepKey = "s" + index;
        stepLogger.log(Level.DEBUG, stage.tag(), invocationDetails(index));

        long startNanos = System.nanoTime();
        return invoke(stage, current).thenCompose(outcome -> {
            long elapsedNanos = System.nanoTime() - startNanos;
            if (outcome.isFailure()) {
                Exception failure = outcome.failure();
                recorder.onStepError(name, stepKey, stage.tag(), failure);
                recorder.onShortCircuit(name, stepKey, stage.tag());
                stepLogger.log(Level.WARN, stage.tag(), failureDetails(index, failure));
                return CompletableFuture.completedFuture(outcome);
            }
            recorder.onStepSuccess(name, stepKey, stage.tag(), elapsedNanos);
            return runFrom(index + 1, outcome.value());
        });
    }

    private static CompletableFuture<Outcome<Object>> invoke(Stage stage, Object current) {
        try {
            CompletableFuture<Outcome<Object>> pending = stage.step().apply(current);
            if (pending == null) return Steps.fail(new IllegalStateException("Step returned null: " + stage.tag()));
            return Steps.recover(pending);
        } catch (Exception ex) {
            return Steps.fail(ex);
        }
    }

    private Map<String, Object> invocationDetails(int index) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("pipeline", name);
        details.put("step", index);
        return details;
    }

    private Map<String, Object> failureDetails(int index, Exception failure) {
        Map<String, Object> details = invocationDetails(index);
        details.put("error", failure.getClass().getSimpleName());
        details.put("message", String.valueOf(failure.getMessage()));
        return details;
    }

    private record Stage(String tag, AsyncStep<Object, Object> step) {}
}
