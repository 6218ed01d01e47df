package com.signup.identity.result;

import java.util.Objects;

public record RegistrationResult(ResultStatus status, String message) {
  public RegistrationResult {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(message, "message");
  }

  public boolean isSuccess() {
    return status == ResultStatus.CREATED;
  }
}
