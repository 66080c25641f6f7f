package com.codeheadsystems.veil.exceptions;

import java.util.Map;

/**
 * The prover failed, or its output did not pass local verification.
 */
public class ProofGenerationException extends VeilException {

  /**
   * Instantiates a new Proof generation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ProofGenerationException(final String message, final Throwable cause) {
    super(ErrorKind.PROOF_GENERATION_FAILED, message, Map.of(), cause);
  }

  /**
   * Instantiates a new Proof generation exception with context.
   *
   * @param message the message
   * @param context the context
   * @param cause   the cause
   */
  public ProofGenerationException(final String message, final Map<String, String> context,
                                  final Throwable cause) {
    super(ErrorKind.PROOF_GENERATION_FAILED, message, context, cause);
  }
}
