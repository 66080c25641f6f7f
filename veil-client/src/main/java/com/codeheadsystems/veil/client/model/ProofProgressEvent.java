package com.codeheadsystems.veil.client.model;

import java.time.Instant;

/**
 * One entry in a proof job's event stream.
 *
 * @param stage  the stage reached
 * @param at     when it was reached
 * @param detail short human readable detail, never secret material
 */
public record ProofProgressEvent(ProofStage stage, Instant at, String detail) {
}
