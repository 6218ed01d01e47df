package com.signup.identity.domain;

import java.util.Objects;

/** Canonical (lower-case) UUID identifying a user. */
public record UserId(String value) {
  public UserId {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) throw new IllegalArgumentException("user id must not be blank");
  }

  @Override
  public String toString() {
    return value;
  }
}
