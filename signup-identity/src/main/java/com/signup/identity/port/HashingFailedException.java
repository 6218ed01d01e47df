package com.signup.identity.port;

public class HashingFailedException extends RuntimeException {
  public HashingFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
