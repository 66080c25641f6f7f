package com.codeheadsystems.veil.client.model;

/**
 * Coarse proof generation stages. {@code DONE}, {@code ABORTED} and {@code FAILED} are terminal.
 */
public enum ProofStage {
  SETUP,
  WITNESS,
  PROVING,
  DONE,
  ABORTED,
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == ABORTED || this == FAILED;
  }
}
