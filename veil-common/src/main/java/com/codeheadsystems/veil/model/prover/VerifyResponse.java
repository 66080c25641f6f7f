package com.codeheadsystems.veil.model.prover;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Verification verdict.
 *
 * @param valid true when the proof verifies
 */
public record VerifyResponse(@JsonProperty("valid") boolean valid) {
}
