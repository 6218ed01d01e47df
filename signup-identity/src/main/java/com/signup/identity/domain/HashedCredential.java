package com.signup.identity.domain;

import java.util.Objects;

/** Encoded one-way hash of a credential; holds nothing of the plaintext. */
public record HashedCredential(String value) {
  public HashedCredential {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) throw new IllegalArgumentException("hashed credential must not be blank");
  }

  @Override
  public String toString() {
    return "HashedCredential[***]";
  }
}
