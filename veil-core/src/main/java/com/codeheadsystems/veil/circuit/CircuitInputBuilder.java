package com.codeheadsystems.veil.circuit;

import com.codeheadsystems.veil.commitment.CommitmentScheme;
import com.codeheadsystems.veil.common.ByteUtils;
import com.codeheadsystems.veil.exceptions.InvalidCircuitInputException;
import com.codeheadsystems.veil.merkle.MerkleProof;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.DepositNote;
import java.util.ArrayList;
import java.util.List;

/**
 * Assembles and validates {@link CircuitInputs}. Every check here runs before the prover is
 * touched.
 */
public class CircuitInputBuilder {

  private final CommitmentScheme scheme;

  /**
   * Instantiates a new Circuit input builder.
   *
   * @param scheme the scheme
   */
  public CircuitInputBuilder(final CommitmentScheme scheme) {
    this.scheme = scheme;
  }

  /**
   * Build withdrawal circuit inputs.
   *
   * @param note        the note
   * @param merkleProof the merkle proof for the note's commitment
   * @param treeDepth   the depth of the tree the proof came from
   * @param recipient   the recipient
   * @param relayer     the relayer, or null for a self-paid withdrawal
   * @param fee         the fee in base units
   * @return the circuit inputs
   * @throws InvalidCircuitInputException on any shape violation
   */
  public CircuitInputs build(final DepositNote note,
                             final MerkleProof merkleProof,
                             final int treeDepth,
                             final Address recipient,
                             final Address relayer,
                             final long fee) {
    if (note == null) {
      throw new InvalidCircuitInputException("note", "is required");
    }
    if (merkleProof == null) {
      throw new InvalidCircuitInputException("merkleProof", "is required");
    }
    if (recipient == null) {
      throw new InvalidCircuitInputException("recipient", "is required");
    }
    final byte[] secret = requireField(note.secret(), "secret");
    final byte[] nullifierPreimage = requireField(note.nullifierPreimage(), "nullifierPreimage");
    final byte[] root = requireField(merkleProof.root(), "root");

    final List<byte[]> siblings = merkleProof.siblings();
    if (siblings.size() != treeDepth) {
      throw new InvalidCircuitInputException("siblings",
          "expected " + treeDepth + " siblings, got " + siblings.size());
    }
    final List<byte[]> checkedSiblings = new ArrayList<>(siblings.size());
    for (byte[] sibling : siblings) {
      checkedSiblings.add(requireField(sibling, "siblings"));
    }
    if (treeDepth < Long.SIZE - 1 && merkleProof.leafIndex() >= (1L << treeDepth)) {
      throw new InvalidCircuitInputException("leafIndex", "does not fit a depth " + treeDepth + " tree");
    }
    final int[] pathBits = MerkleProof.pathBits(merkleProof.leafIndex(), treeDepth);
    for (int bit : pathBits) {
      if (bit != 0 && bit != 1) {
        throw new InvalidCircuitInputException("pathBits", "bits must be 0 or 1");
      }
    }
    if (fee < 0) {
      throw new InvalidCircuitInputException("fee", "must not be negative");
    }
    if (fee > note.denomination()) {
      throw new InvalidCircuitInputException("fee", "exceeds denomination " + note.denomination());
    }
    if (fee > 0 && relayer == null) {
      throw new InvalidCircuitInputException("fee", "a non-zero fee requires a relayer");
    }
    if (note.recipient() != null && !note.recipient().equals(recipient)) {
      throw new InvalidCircuitInputException("recipient", "does not match the recipient bound in the note");
    }
    // Self-paid withdrawals put the recipient in the relayer slot.
    final Address effectiveRelayer = relayer == null ? recipient : relayer;
    final byte[] nullifierHash = scheme.nullifierHash(nullifierPreimage, note.poolId());
    return new CircuitInputs(nullifierPreimage, secret, List.copyOf(checkedSiblings), pathBits, root,
        nullifierHash, recipient, effectiveRelayer, fee, note.recipient());
  }

  private static byte[] requireField(final byte[] value, final String name) {
    if (value == null || value.length != ByteUtils.FIELD_LENGTH) {
      throw new InvalidCircuitInputException(name, "must be " + ByteUtils.FIELD_LENGTH + " bytes");
    }
    return value;
  }
}
