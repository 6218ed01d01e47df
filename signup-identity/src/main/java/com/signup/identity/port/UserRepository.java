package com.signup.identity.port;

import com.signup.identity.domain.EmailAddress;
import com.signup.identity.domain.User;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * User storage. Implementations must enforce email uniqueness on {@link #save(User)};
 * that constraint, not any earlier lookup, is the authoritative guard against duplicates.
 */
public interface UserRepository {
  CompletableFuture<Optional<User>> findByEmail(EmailAddress email);

  /** Completes exceptionally with {@link DuplicateEmailException} when the email is taken. */
  CompletableFuture<Void> save(User user);
}
