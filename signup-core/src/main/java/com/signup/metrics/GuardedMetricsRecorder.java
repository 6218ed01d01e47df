package com.signup.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class GuardedMetricsRecorder implements MetricsRecorder {
    private static final Logger log = LoggerFactory.getLogger(GuardedMetricsRecorder.class);

    private final MetricsRecorder delegate;

    GuardedMetricsRecorder(MetricsRecorder delegate) {
        this.delegate = delegate;
    }

    @Override
    public void onStepSuccess(String pipeline, String stepKey, String tag, long nanos) {
        try {
            delegate.onStepSuccess(pipeline, stepKey, tag, nanos);
        } catch (RuntimeException ex) {
            log.warn("metrics recorder failed for {}.{} ('{}')", pipeline, stepKey, tag, ex);
        }
    }

    @Override
    public void onStepError(String pipeline, String stepKey, String tag, Throwable t) {
        try {
            delegate.onStepError(pipeline, stepKey, tag, t);
        } catch (RuntimeException ex) {
            log.warn("metrics recorder failed for {}.{} ('{}')", pipeline, stepKey, tag, ex);
        }
    }

    @Override
    public void onShortCircuit(String pipeline, String stepKey, String tag) {
        try {
            delegate.onShortCircuit(pipeline, stepKey, tag);
        } catch (RuntimeException ex) {
            log.warn("metrics recorder failed for {}.{} ('{}')", pipeline, stepKey, tag, ex);
        }
    }

    @Override
    public MeterRegistry registry() {
        return delegate.registry();
    }
}
