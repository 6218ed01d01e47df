package com.signup.identity.adapter;

import com.signup.identity.port.IdentifierGenerator;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

public final class UuidIdentifierGenerator implements IdentifierGenerator {
  @Override
  public CompletableFuture<String> generateIdentifier() {
    return CompletableFuture.completedFuture(UUID.randomUUID().toString());
  }
}
