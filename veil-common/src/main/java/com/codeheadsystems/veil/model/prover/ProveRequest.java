package com.codeheadsystems.veil.model.prover;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Asks the prover service for a withdrawal proof.
 * <p>
 * Inputs are keyed by circuit signal name. Every value is a list of decimal strings so scalar
 * and array signals share one shape: {@code root} has one entry, {@code pathElements} has one
 * per tree level.
 * <p>
 * Used by: {@code POST /prove}
 *
 * @param requestId      caller-chosen id echoed back in the response
 * @param circuitId      identifier of the compiled circuit (witness generator)
 * @param provingKeyId   identifier of the proving key
 * @param inputs         named circuit inputs
 */
public record ProveRequest(@JsonProperty("requestId") String requestId,
                           @JsonProperty("circuit") String circuitId,
                           @JsonProperty("provingKey") String provingKeyId,
                           @JsonProperty("inputs") Map<String, List<String>> inputs) {
}
