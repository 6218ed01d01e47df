package com.signup.identity.validation;

import com.signup.identity.domain.UserId;

import java.util.Locale;
import java.util.regex.Pattern;

/** RFC 4122 textual UUID, canonicalized to lower case. */
public final class IdentifierFormat implements ValueShape<UserId> {
  public static final IdentifierFormat UUID = new IdentifierFormat();

  private static final Pattern UUID_TEXT =
      Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

  private IdentifierFormat() {}

  @Override
  public UserId decode(Object raw) {
    String text = ValueShape.requireString(raw);
    if (!UUID_TEXT.matcher(text).matches()) throw new IllegalArgumentException("must be a UUID");
    return new UserId(text.toLowerCase(Locale.ROOT));
  }
}
