package com.signup.identity.command;

/** Raw, unvalidated registration request as received from the transport. */
public record RegisterUser(String email, String credential) {
  @Override
  public String toString() {
    return "RegisterUser[email=" + email + ", credential=***]";
  }
}
