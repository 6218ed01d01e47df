package com.signup.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.Map;
import java.util.Objects;

/** {@link StepLogger} writing SLF4J key/value events under a named context (e.g. "SignUp"). */
public final class Slf4jStepLogger implements StepLogger {
    private final String context;
    private final Logger log;

    public Slf4jStepLogger(String context) {
        this.context = Objects.requireNonNull(context, "context");
        this.log = LoggerFactory.getLogger("signup." + context);
    }

    @Override
    public void log(Level level, String tag, Map<String, ?> details) {
        if (!log.isEnabledForLevel(level)) return;
        LoggingEventBuilder event = log.atLevel(level).addKeyValue("context", context);
        if (details != null) {
            for (var e : details.entrySet()) event = event.addKeyValue(e.getKey(), e.getValue());
        }
        event.log(tag);
    }
}
