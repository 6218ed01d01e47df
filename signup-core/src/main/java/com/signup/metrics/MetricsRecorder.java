package com.signup.metrics;

import io.micrometer.core.instrument.MeterRegistry;

import java.util.Objects;

public interface MetricsRecorder {
    void onStepSuccess(String pipeline, String stepKey, String tag, long nanos);
    void onStepError(String pipeline, String stepKey, String tag, Throwable t);
    void onShortCircuit(String pipeline, String stepKey, String tag);
    MeterRegistry registry();

    /** Wraps {@code delegate} so a failing meter is reported to SLF4J and never fails a run. */
    static MetricsRecorder guarded(MetricsRecorder delegate) {
        Objects.requireNonNull(delegate, "delegate");
        if (delegate instanceof GuardedMetricsRecorder) return delegate;
        return new GuardedMetricsRecorder(delegate);
    }
}
