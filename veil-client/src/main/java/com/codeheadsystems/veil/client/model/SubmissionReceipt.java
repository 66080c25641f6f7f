package com.codeheadsystems.veil.client.model;

import java.time.Instant;

/**
 * Confirmation returned by the ledger for a submitted operation.
 *
 * @param transactionId the transaction id
 * @param confirmedAt   the confirmation time
 */
public record SubmissionReceipt(String transactionId, Instant confirmedAt) {
}
