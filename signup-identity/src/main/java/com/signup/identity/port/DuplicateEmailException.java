package com.signup.identity.port;

/** Raised by a store whose uniqueness constraint on email rejected a write. */
public class DuplicateEmailException extends StorageException {
  public DuplicateEmailException(String email) {
    super("a user with email '" + email + "' is already stored");
  }
}
