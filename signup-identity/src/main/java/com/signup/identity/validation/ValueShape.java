package com.signup.identity.validation;

/**
 * Target shape for an untyped raw value.
 * {@link #decode(Object)} throws {@link IllegalArgumentException} whose message is the rejection reason.
 */
@FunctionalInterface
public interface ValueShape<T> {
  T decode(Object raw);

  static String requireString(Object raw) {
    if (raw == null) throw new IllegalArgumentException("is required");
    if (!(raw instanceof String)) throw new IllegalArgumentException("must be a string");
    return (String) raw;
  }
}
