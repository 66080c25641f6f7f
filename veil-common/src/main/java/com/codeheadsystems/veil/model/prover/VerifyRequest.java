package com.codeheadsystems.veil.model.prover;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Asks the prover service to check a proof against its verification key.
 * <p>
 * Used by: {@code POST /verify}
 *
 * @param verificationKeyId identifier of the verification key
 * @param proofBase64       base64-encoded proof bytes
 * @param publicSignals     ordered decimal public signals
 */
public record VerifyRequest(@JsonProperty("verificationKey") String verificationKeyId,
                            @JsonProperty("proof") String proofBase64,
                            @JsonProperty("publicSignals") List<String> publicSignals) {
}
