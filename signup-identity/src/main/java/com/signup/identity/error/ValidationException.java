package com.signup.identity.error;

import java.util.Objects;

/** Raw input rejected by the validation layer; names the offending field. */
public class ValidationException extends RegistrationException {
  private final String field;
  private final String reason;

  public ValidationException(String field, String reason) {
    this(field, reason, null);
  }

  public ValidationException(String field, String reason, Throwable cause) {
    super(ErrorKind.VALIDATION, "Invalid " + field + ": " + reason, cause);
    this.field = Objects.requireNonNull(field, "field");
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public String field() {
    return field;
  }

  public String reason() {
    return reason;
  }
}
