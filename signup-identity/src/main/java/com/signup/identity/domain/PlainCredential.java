package com.signup.identity.domain;

import java.util.Objects;

/** Plaintext credential as typed by the user. Never printed. */
public record PlainCredential(String value) {
  public PlainCredential {
    Objects.requireNonNull(value, "value");
  }

  @Override
  public String toString() {
    return "PlainCredential[***]";
  }
}
