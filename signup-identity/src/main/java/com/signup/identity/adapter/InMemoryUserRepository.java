package com.signup.identity.adapter;

import com.signup.identity.domain.EmailAddress;
import com.signup.identity.domain.User;
import com.signup.identity.port.DuplicateEmailException;
import com.signup.identity.port.UserRepository;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Thread-safe store keyed by canonical email; {@code putIfAbsent} is the uniqueness constraint. */
public final class InMemoryUserRepository implements UserRepository {
  private final ConcurrentMap<String, User> usersByEmail = new ConcurrentHashMap<>();

  @Override
  public CompletableFuture<Optional<User>> findByEmail(EmailAddress email) {
    Objects.requireNonNull(email, "email");
    return CompletableFuture.completedFuture(Optional.ofNullable(usersByEmail.get(email.value())));
  }

  @Override
  public CompletableFuture<Void> save(User user) {
    Objects.requireNonNull(user, "user");
    User previous = usersByEmail.putIfAbsent(user.email().value(), user);
    if (previous != null) return CompletableFuture.failedFuture(new DuplicateEmailException(user.email().value()));
    return CompletableFuture.completedFuture(null);
  }

  public int size() {
    return usersByEmail.size();
  }

  public List<User> all() {
    return List.copyOf(usersByEmail.values());
  }
}
