package com.codeheadsystems.veil.merkle;

import com.codeheadsystems.veil.commitment.CommitmentScheme;
import com.codeheadsystems.veil.common.ByteUtils;
import com.codeheadsystems.veil.model.Address;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalLong;

/**
 * Append-only binary Merkle tree holding every level in memory. Backs the in-memory ledger and
 * lets tests build proofs that match what an indexer would return.
 * <p>
 * Thread safe; all mutators and readers synchronize on the instance.
 */
public class IncrementalMerkleTree {

  private final Address treeId;
  private final int depth;
  private final CommitmentScheme scheme;
  private final byte[][] zeros;
  private final List<List<byte[]>> levels;

  /**
   * Instantiates a new Incremental merkle tree with an all-zero filler.
   *
   * @param treeId the tree id
   * @param depth  the depth
   * @param scheme the scheme
   */
  public IncrementalMerkleTree(final Address treeId, final int depth, final CommitmentScheme scheme) {
    this(treeId, depth, scheme, new byte[ByteUtils.FIELD_LENGTH]);
  }

  /**
   * Instantiates a new Incremental merkle tree.
   *
   * @param treeId    the tree id
   * @param depth     the depth
   * @param scheme    the scheme
   * @param zeroValue the empty-leaf filler
   */
  public IncrementalMerkleTree(final Address treeId, final int depth, final CommitmentScheme scheme,
                               final byte[] zeroValue) {
    if (depth < 1 || depth > MerkleTreeState.MAX_DEPTH) {
      throw new IllegalArgumentException("depth out of range: " + depth);
    }
    this.treeId = treeId;
    this.depth = depth;
    this.scheme = scheme;
    this.zeros = new byte[depth + 1][];
    zeros[0] = ByteUtils.requireLength(zeroValue, ByteUtils.FIELD_LENGTH, "zeroValue").clone();
    for (int i = 1; i <= depth; i++) {
      zeros[i] = scheme.hashPair(zeros[i - 1], zeros[i - 1]);
    }
    this.levels = new ArrayList<>(depth + 1);
    for (int i = 0; i <= depth; i++) {
      levels.add(new ArrayList<>());
    }
  }

  /**
   * Appends a leaf and returns its index.
   *
   * @param leaf the leaf
   * @return the index
   * @throws IllegalStateException when the tree is full
   */
  public synchronized long append(final byte[] leaf) {
    ByteUtils.requireLength(leaf, ByteUtils.FIELD_LENGTH, "leaf");
    final long index = levels.get(0).size();
    if (index >= (1L << depth)) {
      throw new IllegalStateException("Merkle tree is full: " + treeId);
    }
    levels.get(0).add(leaf.clone());
    long nodeIndex = index;
    for (int level = 0; level < depth; level++) {
      final long parentIndex = nodeIndex >>> 1;
      final byte[] left = nodeAt(level, parentIndex << 1);
      final byte[] right = nodeAt(level, (parentIndex << 1) + 1);
      final byte[] parent = scheme.hashPair(left, right);
      final List<byte[]> parents = levels.get(level + 1);
      if (parentIndex < parents.size()) {
        parents.set((int) parentIndex, parent);
      } else {
        parents.add(parent);
      }
      nodeIndex = parentIndex;
    }
    return index;
  }

  /**
   * Current root. An empty tree has the all-zero subtree root.
   *
   * @return the byte [ ]
   */
  public synchronized byte[] root() {
    return nodeAt(depth, 0).clone();
  }

  /**
   * Proof for the leaf at the given index against the current root.
   *
   * @param leafIndex the leaf index
   * @return the merkle proof
   */
  public synchronized MerkleProof proof(final long leafIndex) {
    if (leafIndex < 0 || leafIndex >= levels.get(0).size()) {
      throw new IllegalArgumentException("No leaf at index " + leafIndex);
    }
    final List<byte[]> siblings = new ArrayList<>(depth);
    long nodeIndex = leafIndex;
    for (int level = 0; level < depth; level++) {
      siblings.add(nodeAt(level, nodeIndex ^ 1L));
      nodeIndex >>>= 1;
    }
    return new MerkleProof(treeId, root(), siblings, leafIndex);
  }

  /**
   * Index of the first leaf equal to the given commitment.
   *
   * @param leaf the leaf
   * @return the optional long
   */
  public synchronized OptionalLong indexOf(final byte[] leaf) {
    final List<byte[]> leaves = levels.get(0);
    for (int i = 0; i < leaves.size(); i++) {
      if (Arrays.equals(leaves.get(i), leaf)) {
        return OptionalLong.of(i);
      }
    }
    return OptionalLong.empty();
  }

  /**
   * Snapshot of this tree.
   *
   * @return the merkle tree state
   */
  public synchronized MerkleTreeState state() {
    return new MerkleTreeState(treeId, root(), depth, levels.get(0).size(), zeros[0]);
  }

  public Address treeId() {
    return treeId;
  }

  public int depth() {
    return depth;
  }

  private byte[] nodeAt(final int level, final long index) {
    final List<byte[]> nodes = levels.get(level);
    return index < nodes.size() ? nodes.get((int) index) : zeros[level];
  }
}
