package com.codeheadsystems.veil.exceptions;

import java.util.Map;

/**
 * The ledger received the operation and refused it. Once a spend has been refused the managers
 * translate the {@link RejectionReason} into the matching taxonomy entry
 * ({@link AlreadySpentException}, {@link StaleProofException}).
 */
public class LedgerRejectionException extends VeilException {

  private final RejectionReason reason;

  /**
   * Instantiates a new Ledger rejection exception.
   *
   * @param reason  the reason
   * @param message the message
   */
  public LedgerRejectionException(final RejectionReason reason, final String message) {
    super(ErrorKind.LEDGER_REJECTED, message, Map.of("reason", reason.name()), null);
    this.reason = reason;
  }

  /**
   * The reason.
   *
   * @return the rejection reason
   */
  public RejectionReason reason() {
    return reason;
  }
}
