package com.codeheadsystems.veil.exceptions;

/**
 * Classification of every failure surfaced by the deposit and withdraw flows.
 * <p>
 * {@link #retryable()} tells the caller whether repeating the same operation with the same note
 * can succeed. {@code INVALID_NOTE_FORMAT} and {@code ALREADY_SPENT} are never retryable.
 */
public enum ErrorKind {

  /** The note string could not be decoded. */
  INVALID_NOTE_FORMAT(false),
  /** The note's nullifier is already recorded. */
  ALREADY_SPENT(false),
  /** Every tree is full; new trees must be provisioned. */
  NO_AVAILABLE_TREE(false),
  /** The circuit input vector has the wrong shape. */
  INVALID_CIRCUIT_INPUT(false),
  /** The prover failed or produced a proof that does not verify. */
  PROOF_GENERATION_FAILED(true),
  /** The tree root advanced after the proof was built. */
  STALE_ROOT(true),
  /** The tree root kept advancing past the retry bound. */
  STALE_PROOF(false),
  /** No usable relayer; the caller can withdraw self-paid. */
  RELAYER_UNAVAILABLE(true),
  /** A ledger or prover call failed in transit. */
  NETWORK_ERROR(true),
  /** The ledger refused the operation for a reason not covered above. */
  LEDGER_REJECTED(false),
  /** The request itself is inconsistent (unknown pool, bad fee, duplicate in-flight withdrawal). */
  INVALID_REQUEST(false);

  private final boolean retryable;

  ErrorKind(final boolean retryable) {
    this.retryable = retryable;
  }

  /**
   * Whether the same operation may succeed if repeated.
   *
   * @return the boolean
   */
  public boolean retryable() {
    return retryable;
  }
}
