package com.codeheadsystems.veil.exceptions;

import java.util.Map;

/**
 * The caller asked for something inconsistent: an unknown pool, a fee above the pool maximum, a
 * second withdrawal for a note that is already in flight.
 */
public class InvalidRequestException extends VeilException {

  /**
   * Instantiates a new Invalid request exception.
   *
   * @param message the message
   */
  public InvalidRequestException(final String message) {
    super(ErrorKind.INVALID_REQUEST, message, Map.of(), null);
  }

  /**
   * Instantiates a new Invalid request exception with context.
   *
   * @param message the message
   * @param context the context
   */
  public InvalidRequestException(final String message, final Map<String, String> context) {
    super(ErrorKind.INVALID_REQUEST, message, context, null);
  }
}
