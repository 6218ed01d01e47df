package com.signup.identity.domain;

import java.util.Objects;

/** An email address that passed format validation, held in canonical form. */
public record EmailAddress(String value) {
  public EmailAddress {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) throw new IllegalArgumentException("email must not be blank");
  }

  @Override
  public String toString() {
    return value;
  }
}
