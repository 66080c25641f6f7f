package com.codeheadsystems.veil.client.model;

import com.codeheadsystems.veil.model.Address;
import java.util.List;

/**
 * Outcome of a withdrawal that did not fail: {@link WithdrawState#CONFIRMED} or
 * {@link WithdrawState#ABORTED}. Failures are raised as exceptions.
 *
 * @param state         the final state
 * @param nullifierHash the nullifier hash hex
 * @param recipient     the recipient
 * @param relayer       the relayer, null when self-paid
 * @param fee           the fee paid to the relayer
 * @param receipt       the ledger receipt, null when aborted
 * @param attempts      proof generations performed
 * @param submitted     whether a request reached the ledger
 * @param transitions   states visited, in order
 */
public record WithdrawResult(WithdrawState state,
                             String nullifierHash,
                             Address recipient,
                             Address relayer,
                             long fee,
                             SubmissionReceipt receipt,
                             int attempts,
                             boolean submitted,
                             List<WithdrawState> transitions) {

  public boolean confirmed() {
    return state == WithdrawState.CONFIRMED;
  }
}
