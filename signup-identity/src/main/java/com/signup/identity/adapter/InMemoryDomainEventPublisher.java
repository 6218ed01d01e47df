package com.signup.identity.adapter;

import com.signup.identity.domain.DomainEvent;
import com.signup.identity.domain.EventKind;
import com.signup.identity.port.DomainEventPublisher;
import com.signup.identity.port.EventDeliveryException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process publisher: records every event and hands it to the listeners subscribed to its kind,
 * synchronously and in subscription order. A throwing listener fails the publication, and
 * {@link #published()} lists only events every listener accepted.
 */
public final class InMemoryDomainEventPublisher implements DomainEventPublisher {
  private final Map<EventKind, List<Consumer<DomainEvent>>> listeners = new EnumMap<>(EventKind.class);
  private final List<DomainEvent> published = new CopyOnWriteArrayList<>();

  public InMemoryDomainEventPublisher() {
    for (EventKind kind : EventKind.values()) listeners.put(kind, new CopyOnWriteArrayList<>());
  }

  public InMemoryDomainEventPublisher subscribe(EventKind kind, Consumer<DomainEvent> listener) {
    listeners.get(Objects.requireNonNull(kind, "kind")).add(Objects.requireNonNull(listener, "listener"));
    return this;
  }

  @Override
  public CompletableFuture<Void> publish(DomainEvent event) {
    Objects.requireNonNull(event, "event");
    for (Consumer<DomainEvent> listener : listeners.get(event.key())) {
      try {
        listener.accept(event);
      } catch (RuntimeException ex) {
        return CompletableFuture.failedFuture(new EventDeliveryException("listener failed for " + event.key(), ex));
      }
    }
    published.add(event);
    return CompletableFuture.completedFuture(null);
  }

  public List<DomainEvent> published() {
    return List.copyOf(published);
  }
}
