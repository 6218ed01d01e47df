package com.signup.identity.domain;

/**
 * Registered user. Only ever carries a {@link HashedCredential}.
 * The compact constructor re-checks entity invariants, so a half-built user cannot exist.
 */
public record User(UserId id, EmailAddress email, HashedCredential credential) {
  public User {
    if (id == null) throw new IllegalArgumentException("user id is required");
    if (email == null) throw new IllegalArgumentException("user email is required");
    if (credential == null) throw new IllegalArgumentException("user credential is required");
  }
}
