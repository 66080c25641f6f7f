package com.codeheadsystems.veil.circuit;

import java.util.Arrays;
import java.util.Objects;

/**
 * Proof bytes plus the public signals they attest to.
 *
 * @param proof   the proof
 * @param signals the signals
 */
public record WithdrawalProof(byte[] proof, PublicSignals signals) {

  /**
   * Instantiates a new Withdrawal proof.
   */
  public WithdrawalProof {
    Objects.requireNonNull(proof, "proof");
    Objects.requireNonNull(signals, "signals");
    if (proof.length == 0) {
      throw new IllegalArgumentException("proof is empty");
    }
    proof = proof.clone();
  }

  @Override
  public byte[] proof() {
    return proof.clone();
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof WithdrawalProof other
        && Arrays.equals(proof, other.proof)
        && signals.equals(other.signals);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(proof) + signals.hashCode();
  }

  @Override
  public String toString() {
    return "WithdrawalProof{proofLength=" + proof.length + ", signals=" + signals.toSignalStrings() + "}";
  }
}
