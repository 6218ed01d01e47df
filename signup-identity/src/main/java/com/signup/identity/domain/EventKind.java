package com.signup.identity.domain;

public enum EventKind {
  USER_CREATED
}
