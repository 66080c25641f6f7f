package com.codeheadsystems.veil.merkle;

import com.codeheadsystems.veil.commitment.CommitmentScheme;
import java.util.Arrays;
import java.util.List;

/**
 * Recomputes a root from a leaf and its path. Used to reject malformed proofs from the indexer
 * before any proving work starts.
 */
public class MerkleProofVerifier {

  private final CommitmentScheme scheme;

  /**
   * Instantiates a new Merkle proof verifier.
   *
   * @param scheme the scheme
   */
  public MerkleProofVerifier(final CommitmentScheme scheme) {
    this.scheme = scheme;
  }

  /**
   * Root implied by the leaf and proof.
   *
   * @param leaf  the leaf
   * @param proof the proof
   * @return the byte [ ]
   */
  public byte[] computeRoot(final byte[] leaf, final MerkleProof proof) {
    final List<byte[]> siblings = proof.siblings();
    final int[] bits = proof.pathBits();
    byte[] node = leaf;
    for (int level = 0; level < siblings.size(); level++) {
      node = bits[level] == 0
          ? scheme.hashPair(node, siblings.get(level))
          : scheme.hashPair(siblings.get(level), node);
    }
    return node;
  }

  /**
   * True when the proof leads from the leaf to the proof's root.
   *
   * @param leaf  the leaf
   * @param proof the proof
   * @return the boolean
   */
  public boolean verify(final byte[] leaf, final MerkleProof proof) {
    if (proof.depth() < Long.SIZE - 1 && proof.leafIndex() >= (1L << proof.depth())) {
      return false;
    }
    return Arrays.equals(computeRoot(leaf, proof), proof.root());
  }
}
