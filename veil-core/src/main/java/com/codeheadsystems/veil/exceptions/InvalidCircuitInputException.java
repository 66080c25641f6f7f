package com.codeheadsystems.veil.exceptions;

import java.util.Map;

/**
 * The assembled circuit inputs have the wrong shape. Raised before the prover is invoked.
 */
public class InvalidCircuitInputException extends VeilException {

  /**
   * Instantiates a new Invalid circuit input exception.
   *
   * @param field   the offending input field
   * @param message the message
   */
  public InvalidCircuitInputException(final String field, final String message) {
    super(ErrorKind.INVALID_CIRCUIT_INPUT, "Invalid circuit input '" + field + "': " + message,
        Map.of("field", field), null);
  }
}
