package com.signup.identity.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.signup.identity.domain.DomainEvent;

import java.io.UncheckedIOException;
import java.util.Map;

/** JSON form of domain events: {@code {"key":"USER_CREATED","payload":{"email":"..."}}}. */
public final class DomainEventJson {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private DomainEventJson() {}

  public static String toJson(DomainEvent event) {
    ObjectNode root = OBJECT_MAPPER.createObjectNode();
    root.put("key", event.key().name());
    ObjectNode payload = root.putObject("payload");
    event.payload().entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .forEach(e -> payload.put(e.getKey(), e.getValue()));
    try {
      return OBJECT_MAPPER.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }
}
