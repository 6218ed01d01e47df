package com.signup.identity.adapter;

import com.signup.identity.domain.HashedCredential;
import com.signup.identity.domain.PlainCredential;
import com.signup.identity.port.CredentialHasher;
import com.signup.identity.port.HashingFailedException;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * PBKDF2-HMAC-SHA256 with a random 16-byte salt.
 * Encoded form: {@code pbkdf2$<iterations>$<base64 salt>$<base64 hash>}.
 */
public final class Pbkdf2CredentialHasher implements CredentialHasher {
  public static final int DEFAULT_ITERATIONS = 120_000;

  private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
  private static final String PREFIX = "pbkdf2";
  private static final int SALT_LEN = 16;
  private static final int KEY_BITS = 256;

  private static final SecureRandom RNG = new SecureRandom();

  private final int iterations;
  private final Executor executor;

  public Pbkdf2CredentialHasher(int iterations, Executor executor) {
    if (iterations < 1) throw new IllegalArgumentException("iterations must be >= 1");
    this.iterations = iterations;
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public int iterations() { return iterations; }

  @Override
  public CompletableFuture<HashedCredential> hash(PlainCredential credential) {
    Objects.requireNonNull(credential, "credential");
    return CompletableFuture.supplyAsync(() -> encode(credential), executor);
  }

  /** Constant-time check of {@code candidate} against an encoded hash produced by this class. */
  public boolean matches(PlainCredential candidate, HashedCredential stored) {
    String[] parts = stored.value().split("\\$");
    if (parts.length != 4 || !PREFIX.equals(parts[0])) return false;
    int storedIterations;
    byte[] salt;
    byte[] expected;
    try {
      storedIterations = Integer.parseInt(parts[1]);
      salt = Base64.getDecoder().decode(parts[2]);
      expected = Base64.getDecoder().decode(parts[3]);
    } catch (IllegalArgumentException malformed) {
      return false;
    }
    if (storedIterations < 1 || salt.length == 0) return false;
    byte[] actual = derive(candidate.value(), salt, storedIterations);
    return MessageDigest.isEqual(expected, actual);
  }

  private HashedCredential encode(PlainCredential credential) {
    byte[] salt = new byte[SALT_LEN];
    RNG.nextBytes(salt);
    byte[] hash = derive(credential.value(), salt, iterations);
    Base64.Encoder b64 = Base64.getEncoder().withoutPadding();
    return new HashedCredential(PREFIX + "$" + iterations + "$" + b64.encodeToString(salt) + "$" + b64.encodeToString(hash));
  }

  private static byte[] derive(String plain, byte[] salt, int iterations) {
    PBEKeySpec spec = new PBEKeySpec(plain.toCharArray(), salt, iterations, KEY_BITS);
    try {
      return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
    } catch (GeneralSecurityException e) {
      throw new HashingFailedException("PBKDF2 derivation failed", e);
    } finally {
      spec.clearPassword();
    }
  }
}
