package com.signup.identity.error;

import java.util.Objects;

/**
 * Terminal failure of a registration run. The message is written for logs;
 * callers get a classified, sanitized view through the result adapter.
 */
public class RegistrationException extends RuntimeException {
  private final ErrorKind kind;

  public RegistrationException(ErrorKind kind, String message) {
    this(kind, message, null);
  }

  public RegistrationException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }

  public static RegistrationException conflict(String message) {
    return new RegistrationException(ErrorKind.CONFLICT, message);
  }

  public static RegistrationException conflict(String message, Throwable cause) {
    return new RegistrationException(ErrorKind.CONFLICT, message, cause);
  }

  public static RegistrationException hashing(Throwable cause) {
    return new RegistrationException(ErrorKind.HASHING, "Credential hashing failed.", cause);
  }

  public static RegistrationException entityConstruction(Throwable cause) {
    return new RegistrationException(ErrorKind.ENTITY_CONSTRUCTION,
        "User entity rejected: " + cause.getMessage(), cause);
  }

  public static RegistrationException persistence(String message, Throwable cause) {
    return new RegistrationException(ErrorKind.PERSISTENCE, message, cause);
  }

  public static RegistrationException eventPublication(Throwable cause) {
    return new RegistrationException(ErrorKind.EVENT_PUBLICATION,
        "User created event could not be published; the user is already stored.", cause);
  }
}
