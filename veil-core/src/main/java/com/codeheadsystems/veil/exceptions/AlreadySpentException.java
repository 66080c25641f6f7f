package com.codeheadsystems.veil.exceptions;

import java.util.Map;

/**
 * The nullifier for this note is already recorded, either seen by a local check or reported by
 * the ledger when it rejected the spend.
 */
public class AlreadySpentException extends VeilException {

  private final String nullifierHashHex;

  /**
   * Instantiates a new Already spent exception.
   *
   * @param nullifierHashHex the nullifier hash hex
   */
  public AlreadySpentException(final String nullifierHashHex) {
    this(nullifierHashHex, null);
  }

  /**
   * Instantiates a new Already spent exception.
   *
   * @param nullifierHashHex the nullifier hash hex
   * @param cause            the ledger rejection, when the spend was refused late
   */
  public AlreadySpentException(final String nullifierHashHex, final Throwable cause) {
    super(ErrorKind.ALREADY_SPENT, "Note has already been spent: " + nullifierHashHex,
        Map.of(NULLIFIER_HASH, nullifierHashHex), cause);
    this.nullifierHashHex = nullifierHashHex;
  }

  /**
   * The nullifier hash hex.
   *
   * @return the string
   */
  public String nullifierHashHex() {
    return nullifierHashHex;
  }
}
