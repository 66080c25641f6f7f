package com.codeheadsystems.veil.exceptions;

/**
 * Why the ledger refused a submitted operation.
 */
public enum RejectionReason {
  NULLIFIER_ALREADY_SPENT,
  INVALID_MERKLE_ROOT,
  INVALID_PROOF,
  FEE_TOO_HIGH,
  INVALID_DENOMINATION,
  POOL_INACTIVE,
  MERKLE_TREE_FULL,
  OTHER
}
