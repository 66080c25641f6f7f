package com.codeheadsystems.veil.client.accessor;

import com.codeheadsystems.veil.circuit.CircuitInputs;
import com.codeheadsystems.veil.circuit.WithdrawalProof;
import com.codeheadsystems.veil.client.config.CircuitArtifacts;
import com.codeheadsystems.veil.client.model.ProofStage;
import java.util.function.Consumer;

/**
 * The external zero-knowledge prover. Treated as an opaque, slow, side-effect free function.
 */
public interface ProverAccessor {

  /**
   * Produces a proof. Implementations report {@link ProofStage#WITNESS} and
   * {@link ProofStage#PROVING} through the listener as they reach them.
   *
   * @param inputs        the inputs
   * @param artifacts     the artifacts
   * @param stageListener the stage listener
   * @return the withdrawal proof
   */
  WithdrawalProof prove(CircuitInputs inputs, CircuitArtifacts artifacts, Consumer<ProofStage> stageListener);

  /**
   * Checks a proof against the verification key.
   *
   * @param proof     the proof
   * @param artifacts the artifacts
   * @return true when valid
   */
  boolean verify(WithdrawalProof proof, CircuitArtifacts artifacts);
}
