package com.codeheadsystems.veil.exceptions;

import java.util.Map;

/**
 * A call to the ledger (or another remote collaborator) failed in transit. Transient.
 */
public class LedgerAccessException extends VeilException {

  /**
   * Instantiates a new Ledger access exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public LedgerAccessException(final String message, final Throwable cause) {
    super(ErrorKind.NETWORK_ERROR, message, Map.of(), cause);
  }
}
