package com.codeheadsystems.veil.exceptions;

import java.util.Map;

/**
 * No relayer could be used. Callers fall back to a self-paid withdrawal.
 */
public class RelayerUnavailableException extends VeilException {

  /**
   * Instantiates a new Relayer unavailable exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public RelayerUnavailableException(final String message, final Throwable cause) {
    super(ErrorKind.RELAYER_UNAVAILABLE, message, Map.of(), cause);
  }
}
