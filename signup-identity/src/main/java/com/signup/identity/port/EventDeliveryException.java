package com.signup.identity.port;

public class EventDeliveryException extends RuntimeException {
  public EventDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
