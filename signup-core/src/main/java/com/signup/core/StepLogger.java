package com.signup.core;

import org.slf4j.event.Level;

import java.util.Map;
import java.util.Objects;

/**
 * Structured diagnostic sink used by steps and validators.
 * Implementations may throw; wrap them with {@link #guarded(StepLogger)} so that never aborts a run.
 */
@FunctionalInterface
public interface StepLogger {
    void log(Level level, String tag, Map<String, ?> details);

    /** Wraps {@code delegate} so its failures are reported to SLF4J instead of propagating. */
    static StepLogger guarded(StepLogger delegate) {
        Objects.requireNonNull(delegate, "delegate");
        if (delegate instanceof GuardedStepLogger) return delegate;
        return new GuardedStepLogger(delegate);
    }
}
