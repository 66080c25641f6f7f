package com.codeheadsystems.veil.client.model;

/**
 * Withdrawal lifecycle.
 */
public enum WithdrawState {
  IDLE,
  NOTE_PARSED,
  NULLIFIER_CHECKED,
  PROOF_GENERATED,
  SUBMITTED,
  CONFIRMED,
  FAILED,
  ALREADY_SPENT,
  ABORTED
}
