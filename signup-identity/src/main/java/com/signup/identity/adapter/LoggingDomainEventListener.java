package com.signup.identity.adapter;

import com.signup.identity.domain.DomainEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/** Logs each delivered event as JSON at INFO. */
public final class LoggingDomainEventListener implements Consumer<DomainEvent> {
  private static final Logger log = LoggerFactory.getLogger(LoggingDomainEventListener.class);

  @Override
  public void accept(DomainEvent event) {
    if (log.isInfoEnabled()) log.info("domain event {}", DomainEventJson.toJson(event));
  }
}
