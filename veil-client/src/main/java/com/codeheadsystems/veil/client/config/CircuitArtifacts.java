package com.codeheadsystems.veil.client.config;

/**
 * Identifiers of the compiled withdrawal circuit and its keys, as known to the prover service.
 *
 * @param circuitId         the circuit (witness generator) id
 * @param provingKeyId      the proving key id
 * @param verificationKeyId the verification key id
 */
public record CircuitArtifacts(String circuitId, String provingKeyId, String verificationKeyId) {

  /**
   * The artifacts shipped with the reference circuit build.
   */
  public static final CircuitArtifacts DEFAULT =
      new CircuitArtifacts("withdraw", "withdraw_final.zkey", "verification_key.json");
}
