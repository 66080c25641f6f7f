package com.codeheadsystems.veil.client.model;

import com.codeheadsystems.veil.exceptions.VeilException;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.DepositNote;
import java.util.List;

/**
 * Outcome of a deposit.
 * <p>
 * When {@link #submitted()} is true funds may have moved, so the note is always returned, even
 * if {@link #confirmed()} is false. The caller must keep it to retry or check status.
 *
 * @param state       the final state
 * @param note        the note, null only when aborted before submission
 * @param noteString  the encoded note
 * @param commitment  the commitment hex
 * @param treeId      the tree selected, null if selection never happened
 * @param receipt     the ledger receipt, null unless confirmed
 * @param error       the failure, null unless failed
 * @param submitted   whether a request reached the ledger
 * @param transitions states visited, in order
 */
public record DepositResult(DepositState state,
                            DepositNote note,
                            String noteString,
                            String commitment,
                            Address treeId,
                            SubmissionReceipt receipt,
                            VeilException error,
                            boolean submitted,
                            List<DepositState> transitions) {

  public boolean confirmed() {
    return state == DepositState.CONFIRMED;
  }

  @Override
  public String toString() {
    return "DepositResult{state=" + state + ", commitment=" + commitment + ", treeId=" + treeId
        + ", submitted=" + submitted + ", receipt=" + receipt + ", error=" + error + "}";
  }
}
