package com.signup.identity.port;

import com.signup.identity.domain.HashedCredential;
import com.signup.identity.domain.PlainCredential;

import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface CredentialHasher {
  /** Completes exceptionally (typically {@link HashingFailedException}) when hashing fails. */
  CompletableFuture<HashedCredential> hash(PlainCredential credential);
}
