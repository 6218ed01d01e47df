package com.signup.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public final class SimpleMetricsRecorder implements MetricsRecorder {
    private final MeterRegistry registry;

    public SimpleMetricsRecorder() {
        this(new SimpleMeterRegistry());
    }

    public SimpleMetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onStepSuccess(String pipeline, String stepKey, String tag, long nanos) {
        Timer.builder(metric(pipeline, stepKey, "duration"))
                .tag("step", tag)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void onStepError(String pipeline, String stepKey, String tag, Throwable t) {
        Counter.builder(metric(pipeline, stepKey, "errors"))
                .tag("step", tag)
                .tag("exception", t.getClass().getSimpleName())
                .register(registry)
                .increment();
    }

    @Override
    public void onShortCircuit(String pipeline, String stepKey, String tag) {
        Counter.builder(metric(pipeline, stepKey, "short_circuits"))
                .tag("step", tag)
                .register(registry)
                .increment();
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    private static String metric(String pipeline, String stepKey, String name) {
        return "signup.pipeline." + pipeline + ".step." + stepKey + "." + name;
    }
}
