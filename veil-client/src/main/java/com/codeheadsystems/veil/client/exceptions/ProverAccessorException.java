package com.codeheadsystems.veil.client.exceptions;

import com.codeheadsystems.veil.exceptions.ErrorKind;
import com.codeheadsystems.veil.exceptions.VeilException;
import java.util.Map;

/**
 * The prover service could not be reached or answered with an error status.
 */
public class ProverAccessorException extends VeilException {

  /**
   * Instantiates a new Prover accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ProverAccessorException(final String message, final Throwable cause) {
    super(ErrorKind.NETWORK_ERROR, message, Map.of(), cause);
  }
}
