package com.signup.identity.result;

import com.signup.core.Outcome;
import com.signup.identity.error.RegistrationException;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Single translation point from internal failure kinds to caller-facing statuses.
 * Conflicts and input validation keep their message; everything else is reported generically
 * so hashing or storage details never leave the process.
 */
public final class ResultAdapter {
  public static final String CREATED_MESSAGE = "User registered.";
  public static final String GENERIC_FAILURE_MESSAGE = "Registration failed.";

  public RegistrationResult toResult(Outcome<Void> outcome) {
    Objects.requireNonNull(outcome, "outcome");
    return outcome.failureIfAny()
        .map(failure -> {
          ResultStatus status = classify(failure);
          return new RegistrationResult(status, publicMessage(status, failure));
        })
        .orElseGet(() -> new RegistrationResult(ResultStatus.CREATED, CREATED_MESSAGE));
  }

  /** Completes normally on success, exceptionally with {@link RegistrationRejectedException} otherwise. */
  public CompletableFuture<Void> toVoid(CompletableFuture<Outcome<Void>> pending) {
    return pending.thenApply(this::toResult).thenApply(result -> {
      if (result.isSuccess()) return null;
      throw new RegistrationRejectedException(result.status(), result.message());
    });
  }

  public ResultStatus classify(Exception failure) {
    if (!(failure instanceof RegistrationException)) return ResultStatus.FAILED;
    return switch (((RegistrationException) failure).kind()) {
      case CONFLICT -> ResultStatus.CONFLICT;
      case VALIDATION -> ResultStatus.INVALID;
      case HASHING, ENTITY_CONSTRUCTION, PERSISTENCE, EVENT_PUBLICATION -> ResultStatus.FAILED;
    };
  }

  private static String publicMessage(ResultStatus status, Exception failure) {
    return switch (status) {
      case CONFLICT, INVALID -> failure.getMessage();
      default -> GENERIC_FAILURE_MESSAGE;
    };
  }
}
