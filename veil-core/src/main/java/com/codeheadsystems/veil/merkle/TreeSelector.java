package com.codeheadsystems.veil.merkle;

import com.codeheadsystems.veil.exceptions.NoAvailableTreeException;
import java.util.Collection;
import java.util.Comparator;

/**
 * Chooses the tree a new deposit goes into.
 * <p>
 * The fullest non-full tree wins so deposits concentrate and each tree's anonymity set grows as
 * fast as possible. Ties go to the lowest tree id.
 */
public final class TreeSelector {

  private static final Comparator<MerkleTreeState> PREFERENCE =
      Comparator.comparingLong(MerkleTreeState::leafCount).reversed()
          .thenComparing(MerkleTreeState::treeId);

  private TreeSelector() {
  }

  /**
   * Pick tree for deposit.
   *
   * @param trees the trees
   * @return the merkle tree state
   * @throws NoAvailableTreeException if every tree is full or none exist
   */
  public static MerkleTreeState pickTreeForDeposit(final Collection<MerkleTreeState> trees) {
    return trees.stream()
        .filter(tree -> !tree.isFull())
        .min(PREFERENCE)
        .orElseThrow(() -> new NoAvailableTreeException(trees.size()));
  }
}
