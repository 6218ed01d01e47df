package com.signup.identity.result;

import com.signup.core.Outcome;
import com.signup.identity.error.ErrorKind;
import com.signup.identity.error.RegistrationException;
import com.signup.identity.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

final class ResultAdapterTest {
  private final ResultAdapter adapter = new ResultAdapter();

  @Test
  void everyKindHasAStatus() {
    for (ErrorKind kind : ErrorKind.values()) {
      ResultStatus status = adapter.classify(new RegistrationException(kind, "m"));
      switch (kind) {
        case CONFLICT -> assertEquals(ResultStatus.CONFLICT, status);
        case VALIDATION -> assertEquals(ResultStatus.INVALID, status);
        default -> assertEquals(ResultStatus.FAILED, status, kind.name());
      }
    }
  }

  @Test
  void unknownFailuresAreGeneric() {
    RegistrationResult result = adapter.toResult(Outcome.failure(new IllegalStateException("secret internals")));

    assertEquals(ResultStatus.FAILED, result.status());
    assertEquals(ResultAdapter.GENERIC_FAILURE_MESSAGE, result.message());
  }

  @Test
  void eventPublicationFailureHidesDetails() {
    RegistrationResult result = adapter.toResult(Outcome.failure(RegistrationException.eventPublication(new RuntimeException("kafka"))));

    assertEquals(ResultStatus.FAILED, result.status());
    assertEquals(ResultAdapter.GENERIC_FAILURE_MESSAGE, result.message());
  }

  @Test
  void validationMessageNamesTheField() {
    RegistrationResult result = adapter.toResult(Outcome.failure(new ValidationException("email", "must contain exactly one '@'")));

    assertEquals(ResultStatus.INVALID, result.status());
    assertEquals("Invalid email: must contain exactly one '@'", result.message());
  }

  @Test
  void toVoidCompletesNormallyOnSuccess() {
    assertNull(adapter.toVoid(CompletableFuture.completedFuture(Outcome.<Void>success(null))).join());
  }

  @Test
  void toVoidFailsWithTheClassifiedStatus() {
    CompletableFuture<Void> pending = adapter.toVoid(
        CompletableFuture.completedFuture(Outcome.<Void>failure(RegistrationException.conflict("Email already exists."))));

    CompletionException ex = assertThrows(CompletionException.class, pending::join);
    RegistrationRejectedException rejected = (RegistrationRejectedException) ex.getCause();
    assertEquals(ResultStatus.CONFLICT, rejected.status());
    assertEquals("Email already exists.", rejected.getMessage());
  }
}
