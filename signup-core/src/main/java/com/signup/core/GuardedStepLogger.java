package com.signup.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.Map;

final class GuardedStepLogger implements StepLogger {
    private static final Logger log = LoggerFactory.getLogger(GuardedStepLogger.class);

    private final StepLogger delegate;

    GuardedStepLogger(StepLogger delegate) {
        this.delegate = delegate;
    }

    @Override
    public void log(Level level, String tag, Map<String, ?> details) {
        try {
            delegate.log(level, tag, details);
        } catch (RuntimeException ex) {
            log.warn("step logger failed for '{}'", tag, ex);
        }
    }
}
