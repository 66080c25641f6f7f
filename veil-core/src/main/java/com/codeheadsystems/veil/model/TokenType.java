package com.codeheadsystems.veil.model;

import java.util.List;
import java.util.Locale;

/**
 * Tokens the pools accept, with their decimal precision and standard denominations (in base
 * units).
 */
public enum TokenType {

  SOL(0, 9, List.of(100_000_000L, 1_000_000_000L, 10_000_000_000L, 100_000_000_000L)),
  USDC(1, 6, List.of(100_000L, 1_000_000L, 10_000_000L, 100_000_000L, 1_000_000_000L));

  private final int code;
  private final int decimals;
  private final List<Long> denominations;

  TokenType(final int code, final int decimals, final List<Long> denominations) {
    this.code = code;
    this.decimals = decimals;
    this.denominations = denominations;
  }

  /**
   * Looks a token up by its on-ledger code.
   *
   * @param code the code
   * @return the token type
   */
  public static TokenType fromCode(final int code) {
    for (TokenType t : values()) {
      if (t.code == code) {
        return t;
      }
    }
    throw new IllegalArgumentException("Unknown token code: " + code);
  }

  /**
   * Case-insensitive name lookup, used by the note codec.
   *
   * @param name the name
   * @return the token type
   */
  public static TokenType fromName(final String name) {
    return valueOf(name.toUpperCase(Locale.ROOT));
  }

  public int code() {
    return code;
  }

  public int decimals() {
    return decimals;
  }

  /**
   * Standard denominations in ascending order, in base units.
   *
   * @return the list
   */
  public List<Long> denominations() {
    return denominations;
  }

  /**
   * Whether the amount is one of the standard denominations.
   *
   * @param amount the amount in base units
   * @return the boolean
   */
  public boolean isStandardDenomination(final long amount) {
    return denominations.contains(amount);
  }
}
