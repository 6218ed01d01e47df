package com.signup.identity.domain;

import java.util.Map;
import java.util.Objects;

public record DomainEvent(EventKind key, Map<String, String> payload) {
  public DomainEvent {
    Objects.requireNonNull(key, "key");
    payload = Map.copyOf(Objects.requireNonNull(payload, "payload"));
  }

  public static DomainEvent userCreated(String email) {
    return new DomainEvent(EventKind.USER_CREATED, Map.of("email", Objects.requireNonNull(email, "email")));
  }
}
