package com.signup.identity.validation;

import com.signup.identity.domain.EmailAddress;

import java.util.Locale;

/**
 * Pragmatic email syntax check: an unquoted dot-atom local part and a DNS host name.
 * Canonical form: surrounding whitespace trimmed, lower-cased.
 */
public final class EmailFormat implements ValueShape<EmailAddress> {
  public static final int DEFAULT_MAX_LENGTH = 254;
  public static final EmailFormat DEFAULT = new EmailFormat(DEFAULT_MAX_LENGTH);

  private static final int MAX_LOCAL_PART = 64;
  private static final int MAX_LABEL = 63;
  private static final String ATEXT_SYMBOLS = "!#$%&'*+/=?^_`{|}~-";

  private final int maxLength;

  public EmailFormat(int maxLength) {
    if (maxLength < 3) throw new IllegalArgumentException("maxLength must be >= 3");
    this.maxLength = maxLength;
  }

  public int maxLength() { return maxLength; }

  @Override
  public EmailAddress decode(Object raw) {
    String email = ValueShape.requireString(raw).strip();
    if (email.isEmpty()) throw new IllegalArgumentException("must not be empty");
    if (email.length() > maxLength) throw new IllegalArgumentException("must be at most " + maxLength + " characters");

    int at = email.indexOf('@');
    if (at < 0 || at != email.lastIndexOf('@')) throw new IllegalArgumentException("must contain exactly one '@'");
    String local = email.substring(0, at);
    String domain = email.substring(at + 1);

    for (int i = 0; i < email.length(); i++) {
      char c = email.charAt(i);
      if (Character.isWhitespace(c) || Character.isISOControl(c)) throw new IllegalArgumentException("must not contain whitespace");
    }
    if (local.isEmpty() || local.length() > MAX_LOCAL_PART || !isDotAtom(local)) {
      throw new IllegalArgumentException("has an invalid local part");
    }
    if (!isValidDomain(domain)) throw new IllegalArgumentException("has an invalid domain");
    return new EmailAddress(email.toLowerCase(Locale.ROOT));
  }

  private static boolean isDotAtom(String local) {
    if (local.startsWith(".") || local.endsWith(".") || local.contains("..")) return false;
    for (int i = 0; i < local.length(); i++) {
      char c = local.charAt(i);
      if (c != '.' && !isAsciiLetterOrDigit(c) && ATEXT_SYMBOLS.indexOf(c) < 0) return false;
    }
    return true;
  }

  private static boolean isValidDomain(String domain) {
    if (domain.isEmpty() || domain.startsWith(".") || domain.endsWith(".")) return false;
    if (!domain.contains(".") || domain.contains("..")) return false;
    for (String label : domain.split("\\.")) {
      if (label.length() > MAX_LABEL) return false;
      if (label.startsWith("-") || label.endsWith("-")) return false;
      for (int i = 0; i < label.length(); i++) {
        char c = label.charAt(i);
        if (c != '-' && !isAsciiLetterOrDigit(c)) return false;
      }
    }
    return true;
  }

  private static boolean isAsciiLetterOrDigit(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }
}
