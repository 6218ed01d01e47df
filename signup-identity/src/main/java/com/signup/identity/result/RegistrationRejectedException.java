package com.signup.identity.result;

/** Completes the caller's future when a registration did not succeed. Carries only public text. */
public class RegistrationRejectedException extends RuntimeException {
  private final ResultStatus status;

  public RegistrationRejectedException(ResultStatus status, String message) {
    super(message);
    this.status = status;
  }

  public ResultStatus status() {
    return status;
  }
}
