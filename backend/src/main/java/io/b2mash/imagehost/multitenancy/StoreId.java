package io.b2mash.imagehost.multitenancy;

import io.b2mash.imagehost.exception.InvalidIdentifierException;
import java.util.regex.Pattern;

/**
 * A validated store identifier. This is the only way to obtain the fragment that store table
 * names are built from: numeric ids must be positive and written without leading zeros, token ids
 * must match {@code ^[a-z0-9_]{1,32}$}. Anything else is rejected with {@link
 * InvalidIdentifierException}, so a {@code StoreId} is always safe to splice into an identifier
 * position. It is never meant for value positions; those are bound as parameters.
 */
public final class StoreId {

  public static final int MAX_LENGTH = 32;

  private static final Pattern TOKEN = Pattern.compile("^[a-z0-9_]{1," + MAX_LENGTH + "}$");
  private static final Pattern DIGITS = Pattern.compile("^[0-9]+$");

  private final String value;

  private StoreId(String value) {
    this.value = value;
  }

  public static StoreId of(long id) {
    if (id <= 0) {
      throw new InvalidIdentifierException("Store id must be a positive integer, got " + id);
    }
    return new StoreId(Long.toString(id));
  }

  public static StoreId of(String raw) {
    if (raw == null || raw.isEmpty()) {
      throw new InvalidIdentifierException("Store id must not be empty");
    }
    if (!TOKEN.matcher(raw).matches()) {
      throw new InvalidIdentifierException(
          "Store id must match [a-z0-9_]{1," + MAX_LENGTH + "}: " + abbreviate(raw));
    }
    if (DIGITS.matcher(raw).matches() && (raw.charAt(0) == '0')) {
      // "7" and "007" would otherwise name different table sets for the same store
      throw new InvalidIdentifierException(
          "Numeric store id must be positive without leading zeros: " + raw);
    }
    return new StoreId(raw);
  }

  public String value() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof StoreId other && value.equals(other.value));
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value;
  }

  private static String abbreviate(String raw) {
    return raw.length() <= 40 ? raw : raw.substring(0, 40) + "...";
  }
}
