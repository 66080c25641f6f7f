package com.codeheadsystems.veil.client.model;

/**
 * Deposit lifecycle.
 */
public enum DepositState {
  IDLE,
  NOTE_GENERATED,
  TREE_SELECTED,
  COMMITMENT_SUBMITTED,
  CONFIRMED,
  FAILED,
  ABORTED
}
