package com.signup.identity.port;

import com.signup.identity.domain.DomainEvent;

import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface DomainEventPublisher {
  CompletableFuture<Void> publish(DomainEvent event);
}
