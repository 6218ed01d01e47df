package com.signup.identity.validation;

import com.signup.identity.domain.EmailAddress;
import com.signup.identity.domain.PlainCredential;
import com.signup.identity.domain.UserId;

import java.util.Objects;

public record ValidatedInput(UserId id, EmailAddress email, PlainCredential credential) {
  public ValidatedInput {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(email, "email");
    Objects.requireNonNull(credential, "credential");
  }
}
