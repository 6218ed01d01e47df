package com.signup.identity.port;

import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface IdentifierGenerator {
  /** A fresh, not yet validated identifier. */
  CompletableFuture<String> generateIdentifier();
}
