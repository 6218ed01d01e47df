package com.signup.identity.command;

import com.signup.identity.result.RegistrationResult;
import com.signup.identity.result.ResultAdapter;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/** Caller-facing entry point for registrations. */
public final class RegisterUserHandler {
  private final RegisterUserPipeline pipeline;
  private final ResultAdapter resultAdapter;

  public RegisterUserHandler(RegisterUserPipeline pipeline) {
    this(pipeline, new ResultAdapter());
  }

  public RegisterUserHandler(RegisterUserPipeline pipeline, ResultAdapter resultAdapter) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.resultAdapter = Objects.requireNonNull(resultAdapter, "resultAdapter");
  }

  public CompletableFuture<RegistrationResult> registerUser(String email, String credential) {
    return pipeline.run(new RegisterUser(email, credential)).thenApply(resultAdapter::toResult);
  }

  /** Void on success; fails with {@link com.signup.identity.result.RegistrationRejectedException} otherwise. */
  public CompletableFuture<Void> execute(RegisterUser command) {
    return resultAdapter.toVoid(pipeline.run(command));
  }
}
