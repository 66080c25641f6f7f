package com.codeheadsystems.veil.exceptions;

import java.util.Map;

/**
 * The proof was built against a root the ledger no longer accepts.
 * <p>
 * Kind {@link ErrorKind#STALE_ROOT} marks a single, retryable mismatch. Kind
 * {@link ErrorKind#STALE_PROOF} is raised once the retry bound is exhausted.
 */
public class StaleProofException extends VeilException {

  private StaleProofException(final ErrorKind kind, final String message,
                              final Map<String, String> context, final Throwable cause) {
    super(kind, message, context, cause);
  }

  /**
   * A single stale-root observation.
   *
   * @param nullifierHashHex the nullifier hash hex
   * @param attempt          the attempt number
   * @param cause            the ledger rejection
   * @return the stale proof exception
   */
  public static StaleProofException staleRoot(final String nullifierHashHex, final int attempt,
                                              final Throwable cause) {
    return new StaleProofException(ErrorKind.STALE_ROOT,
        "Merkle root advanced during proof generation (attempt " + attempt + ")",
        Map.of(NULLIFIER_HASH, nullifierHashHex, ATTEMPT, Integer.toString(attempt)), cause);
  }

  /**
   * Retry bound exhausted.
   *
   * @param nullifierHashHex the nullifier hash hex
   * @param attempts         the attempts made
   * @param cause            the last stale-root observation
   * @return the stale proof exception
   */
  public static StaleProofException exhausted(final String nullifierHashHex, final int attempts,
                                              final Throwable cause) {
    return new StaleProofException(ErrorKind.STALE_PROOF,
        "Proof went stale " + attempts + " times; giving up",
        Map.of(NULLIFIER_HASH, nullifierHashHex, ATTEMPT, Integer.toString(attempts)), cause);
  }
}
