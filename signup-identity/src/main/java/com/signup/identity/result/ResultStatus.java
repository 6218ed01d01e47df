package com.signup.identity.result;

/** Caller-facing classification of a registration, with its HTTP-style status code. */
public enum ResultStatus {
  CREATED(201),
  INVALID(400),
  CONFLICT(409),
  FAILED(500);

  private final int code;

  ResultStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
