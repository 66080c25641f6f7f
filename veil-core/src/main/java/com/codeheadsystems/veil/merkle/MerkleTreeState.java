package com.codeheadsystems.veil.merkle;

import com.codeheadsystems.veil.common.ByteUtils;
import com.codeheadsystems.veil.model.Address;
import java.util.Arrays;
import java.util.Objects;
import org.bouncycastle.util.encoders.Hex;

/**
 * Snapshot of one append-only commitment tree.
 *
 * @param treeId    the tree id
 * @param root      the current root
 * @param depth     the depth; capacity is 2^depth
 * @param leafCount the number of leaves inserted
 * @param zeroValue the filler used for empty leaves
 */
public record MerkleTreeState(Address treeId, byte[] root, int depth, long leafCount, byte[] zeroValue) {

  /**
   * Largest depth supported; leaf indices must fit a long.
   */
  public static final int MAX_DEPTH = 32;

  /**
   * Instantiates a new Merkle tree state.
   */
  public MerkleTreeState {
    Objects.requireNonNull(treeId, "treeId");
    root = ByteUtils.requireLength(root, ByteUtils.FIELD_LENGTH, "root").clone();
    zeroValue = ByteUtils.requireLength(zeroValue, ByteUtils.FIELD_LENGTH, "zeroValue").clone();
    if (depth < 1 || depth > MAX_DEPTH) {
      throw new IllegalArgumentException("depth out of range: " + depth);
    }
    if (leafCount < 0 || leafCount > (1L << depth)) {
      throw new IllegalArgumentException("leafCount out of range: " + leafCount);
    }
  }

  /**
   * State with an all-zero filler, for tests and simple ledgers.
   *
   * @param treeId    the tree id
   * @param root      the root
   * @param depth     the depth
   * @param leafCount the leaf count
   * @return the merkle tree state
   */
  public static MerkleTreeState of(final Address treeId, final byte[] root, final int depth,
                                   final long leafCount) {
    return new MerkleTreeState(treeId, root, depth, leafCount, new byte[ByteUtils.FIELD_LENGTH]);
  }

  @Override
  public byte[] root() {
    return root.clone();
  }

  @Override
  public byte[] zeroValue() {
    return zeroValue.clone();
  }

  public long capacity() {
    return 1L << depth;
  }

  public boolean isFull() {
    return leafCount >= capacity();
  }

  /**
   * Whether the given root equals this tree's current root.
   *
   * @param candidate the candidate
   * @return the boolean
   */
  public boolean hasRoot(final byte[] candidate) {
    return Arrays.equals(root, candidate);
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof MerkleTreeState other
        && depth == other.depth
        && leafCount == other.leafCount
        && treeId.equals(other.treeId)
        && Arrays.equals(root, other.root)
        && Arrays.equals(zeroValue, other.zeroValue);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(treeId, depth, leafCount) + Arrays.hashCode(root);
  }

  @Override
  public String toString() {
    return "MerkleTreeState{treeId=" + treeId + ", root=" + Hex.toHexString(root) + ", depth=" + depth
        + ", leafCount=" + leafCount + "}";
  }
}
