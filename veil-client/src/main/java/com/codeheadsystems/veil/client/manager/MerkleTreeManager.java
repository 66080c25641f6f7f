package com.codeheadsystems.veil.client.manager;

import com.codeheadsystems.veil.client.accessor.LedgerAccessor;
import com.codeheadsystems.veil.client.config.VeilClientConfig;
import com.codeheadsystems.veil.merkle.MerkleProof;
import com.codeheadsystems.veil.merkle.MerkleTreeState;
import com.codeheadsystems.veil.merkle.TreeSelector;
import com.codeheadsystems.veil.model.Address;
import io.github.resilience4j.retry.Retry;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads tree state from the ledger. Roots and proofs are always read live; the ledger owns the
 * trees and a cached root is never trusted for a spend.
 */
@Singleton
public class MerkleTreeManager {
  private static final Logger log = LoggerFactory.getLogger(MerkleTreeManager.class);

  private final LedgerAccessor ledgerAccessor;
  private final Retry retry;

  /**
   * Instantiates a new Merkle tree manager.
   *
   * @param ledgerAccessor   the ledger accessor
   * @param veilClientConfig the veil client config
   */
  @Inject
  public MerkleTreeManager(final LedgerAccessor ledgerAccessor, final VeilClientConfig veilClientConfig) {
    log.info("MerkleTreeManager({})", ledgerAccessor);
    this.ledgerAccessor = ledgerAccessor;
    this.retry = veilClientConfig.readRetry("merkle");
  }

  /**
   * Every tree of the pool.
   *
   * @param poolId the pool id
   * @return the list
   */
  public List<MerkleTreeState> getTrees(final Address poolId) {
    log.debug("getTrees(poolId={})", poolId);
    return read(() -> ledgerAccessor.getTreeIds(poolId)).stream()
        .map(this::getTreeState)
        .collect(Collectors.toList());
  }

  /**
   * Trees of the pool that still have room.
   *
   * @param poolId the pool id
   * @return the list
   */
  public List<MerkleTreeState> getActiveTrees(final Address poolId) {
    return getTrees(poolId).stream().filter(tree -> !tree.isFull()).collect(Collectors.toList());
  }

  /**
   * The tree a new deposit into the pool should go to.
   *
   * @param poolId the pool id
   * @return the merkle tree state
   */
  public MerkleTreeState pickTreeForDeposit(final Address poolId) {
    final MerkleTreeState tree = TreeSelector.pickTreeForDeposit(getTrees(poolId));
    log.trace("pickTreeForDeposit(poolId={}) -> {} ({} leaves)", poolId, tree.treeId(), tree.leafCount());
    return tree;
  }

  /**
   * Current state of one tree.
   *
   * @param treeId the tree id
   * @return the merkle tree state
   */
  public MerkleTreeState getTreeState(final Address treeId) {
    return read(() -> ledgerAccessor.getTreeState(treeId));
  }

  /**
   * Current root of one tree.
   *
   * @param treeId the tree id
   * @return the byte [ ]
   */
  public byte[] getLatestRoot(final Address treeId) {
    return getTreeState(treeId).root();
  }

  /**
   * Locates the commitment in any of the pool's trees and returns its proof against that tree's
   * current root.
   *
   * @param poolId     the pool id
   * @param commitment the commitment
   * @return the optional
   */
  public Optional<MerkleProof> getMerkleProof(final Address poolId, final byte[] commitment) {
    log.debug("getMerkleProof(poolId={}, commitment={})", poolId, Hex.toHexString(commitment));
    for (Address treeId : read(() -> ledgerAccessor.getTreeIds(poolId))) {
      final Optional<MerkleProof> proof = read(() -> ledgerAccessor.findMerkleProof(treeId, commitment));
      if (proof.isPresent()) {
        return proof;
      }
    }
    return Optional.empty();
  }

  private <T> T read(final Supplier<T> call) {
    return Retry.decorateSupplier(retry, call).get();
  }
}
