package com.codeheadsystems.veil.merkle;

import com.codeheadsystems.veil.common.ByteUtils;
import com.codeheadsystems.veil.model.Address;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.bouncycastle.util.encoders.Hex;

/**
 * Membership proof for one leaf: siblings ordered from the leaf level up.
 *
 * @param treeId    the tree the leaf lives in
 * @param root      the root the proof is valid against
 * @param siblings  the siblings, leaf level first
 * @param leafIndex the leaf index
 */
public record MerkleProof(Address treeId, byte[] root, List<byte[]> siblings, long leafIndex) {

  /**
   * Instantiates a new Merkle proof.
   */
  public MerkleProof {
    Objects.requireNonNull(treeId, "treeId");
    root = ByteUtils.requireLength(root, ByteUtils.FIELD_LENGTH, "root").clone();
    final List<byte[]> copy = new ArrayList<>(siblings.size());
    for (byte[] sibling : siblings) {
      copy.add(ByteUtils.requireLength(sibling, ByteUtils.FIELD_LENGTH, "sibling").clone());
    }
    siblings = Collections.unmodifiableList(copy);
    if (leafIndex < 0) {
      throw new IllegalArgumentException("leafIndex must not be negative");
    }
  }

  /**
   * Path bits for a leaf index: bit i is {@code (index >> i) & 1}, least significant first. A
   * 1 bit means the node at that level is a right child.
   *
   * @param leafIndex the leaf index
   * @param depth     the depth
   * @return the bits
   */
  public static int[] pathBits(final long leafIndex, final int depth) {
    final int[] bits = new int[depth];
    for (int i = 0; i < depth; i++) {
      bits[i] = (int) ((leafIndex >>> i) & 1L);
    }
    return bits;
  }

  @Override
  public byte[] root() {
    return root.clone();
  }

  public int depth() {
    return siblings.size();
  }

  public int[] pathBits() {
    return pathBits(leafIndex, siblings.size());
  }

  @Override
  public String toString() {
    return "MerkleProof{treeId=" + treeId + ", root=" + Hex.toHexString(root) + ", leafIndex=" + leafIndex
        + ", depth=" + siblings.size() + "}";
  }
}
