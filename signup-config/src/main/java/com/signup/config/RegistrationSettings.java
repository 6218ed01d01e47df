package com.signup.config;

import com.signup.identity.adapter.Pbkdf2CredentialHasher;
import com.signup.identity.command.RegisterUserPipeline;
import com.signup.identity.validation.CredentialPolicy;
import com.signup.identity.validation.EmailFormat;

import java.util.Objects;

/** Everything a deployment may tune about registration. */
public record RegistrationSettings(String pipelineName,
                                   String loggerContext,
                                   EmailFormat emailFormat,
                                   CredentialPolicy credentialPolicy,
                                   int hashIterations) {
  public static final String DEFAULT_LOGGER_CONTEXT = "SignUp";

  public RegistrationSettings {
    Objects.requireNonNull(pipelineName, "pipelineName");
    Objects.requireNonNull(loggerContext, "loggerContext");
    Objects.requireNonNull(emailFormat, "emailFormat");
    Objects.requireNonNull(credentialPolicy, "credentialPolicy");
    if (pipelineName.isBlank()) throw new IllegalArgumentException("pipelineName must not be blank");
    if (hashIterations < 1) throw new IllegalArgumentException("hashIterations must be >= 1");
  }

  public static RegistrationSettings defaults() {
    return new RegistrationSettings(RegisterUserPipeline.DEFAULT_NAME, DEFAULT_LOGGER_CONTEXT,
        EmailFormat.DEFAULT, CredentialPolicy.DEFAULT, Pbkdf2CredentialHasher.DEFAULT_ITERATIONS);
  }
}
