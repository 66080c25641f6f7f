package com.codeheadsystems.veil.model.prover;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Prover output: { requestId, proof, publicSignals }.
 *
 * @param requestId     the request id from the matching request
 * @param proofBase64   base64-encoded proof bytes
 * @param publicSignals ordered decimal public signals: root, nullifierHash, recipient, relayer, fee
 */
public record ProveResponse(@JsonProperty("requestId") String requestId,
                            @JsonProperty("proof") String proofBase64,
                            @JsonProperty("publicSignals") List<String> publicSignals) {
}
