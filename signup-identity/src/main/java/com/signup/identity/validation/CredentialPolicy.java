package com.signup.identity.validation;

import com.signup.identity.domain.PlainCredential;

/**
 * Credential acceptance rules. The default only demands a non-empty value of bounded length;
 * stricter character-class rules are opt-in through settings.
 */
public final class CredentialPolicy implements ValueShape<PlainCredential> {
  public static final CredentialPolicy DEFAULT = new CredentialPolicy(1, 256, false, false, false);

  private final int minLength;
  private final int maxLength;
  private final boolean requireDigit;
  private final boolean requireLetter;
  private final boolean requireSymbol;

  public CredentialPolicy(int minLength, int maxLength, boolean requireDigit, boolean requireLetter, boolean requireSymbol) {
    if (minLength < 1) throw new IllegalArgumentException("minLength must be >= 1");
    if (maxLength < minLength) throw new IllegalArgumentException("maxLength must be >= minLength");
    this.minLength = minLength;
    this.maxLength = maxLength;
    this.requireDigit = requireDigit;
    this.requireLetter = requireLetter;
    this.requireSymbol = requireSymbol;
  }

  public int minLength() { return minLength; }
  public int maxLength() { return maxLength; }
  public boolean requireDigit() { return requireDigit; }
  public boolean requireLetter() { return requireLetter; }
  public boolean requireSymbol() { return requireSymbol; }

  @Override
  public PlainCredential decode(Object raw) {
    String value = ValueShape.requireString(raw);
    if (value.isEmpty()) throw new IllegalArgumentException("must not be empty");
    if (value.length() < minLength) throw new IllegalArgumentException("must be at least " + minLength + " characters");
    if (value.length() > maxLength) throw new IllegalArgumentException("must be at most " + maxLength + " characters");
    if (requireDigit && value.chars().noneMatch(Character::isDigit)) {
      throw new IllegalArgumentException("must contain a digit");
    }
    if (requireLetter && value.chars().noneMatch(Character::isLetter)) {
      throw new IllegalArgumentException("must contain a letter");
    }
    if (requireSymbol && value.chars().allMatch(Character::isLetterOrDigit)) {
      throw new IllegalArgumentException("must contain a symbol");
    }
    return new PlainCredential(value);
  }
}
