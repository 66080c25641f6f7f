package com.codeheadsystems.veil.client.model;

import com.codeheadsystems.veil.circuit.WithdrawalProof;

/**
 * How a proof job ended, when it did not fail.
 *
 * @param proof     the proof, null when aborted
 * @param fromCache whether the proof was served from the proof cache
 */
public record ProofOutcome(WithdrawalProof proof, boolean fromCache) {

  /**
   * The job was cancelled and its work discarded.
   */
  public static final ProofOutcome ABORTED = new ProofOutcome(null, false);

  public boolean aborted() {
    return proof == null;
  }
}
