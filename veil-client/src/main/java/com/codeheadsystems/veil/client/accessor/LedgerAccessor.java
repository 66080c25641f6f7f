package com.codeheadsystems.veil.client.accessor;

import com.codeheadsystems.veil.client.model.SubmissionReceipt;
import com.codeheadsystems.veil.exceptions.LedgerAccessException;
import com.codeheadsystems.veil.exceptions.LedgerRejectionException;
import com.codeheadsystems.veil.ledger.AccountFilter;
import com.codeheadsystems.veil.ledger.AccountRecord;
import com.codeheadsystems.veil.ledger.LedgerOperation;
import com.codeheadsystems.veil.merkle.MerkleProof;
import com.codeheadsystems.veil.merkle.MerkleTreeState;
import com.codeheadsystems.veil.model.Address;
import java.util.List;
import java.util.Optional;

/**
 * The ledger and its indexer, as seen by this client. The ledger owns the trees and the nullifier
 * set and enforces every spend rule; this client only reads state and submits operations.
 * <p>
 * Every method may throw {@link LedgerAccessException} for transport failures.
 */
public interface LedgerAccessor {

  /**
   * Program-owned accounts matching the filter.
   *
   * @param filter the filter
   * @return the list
   */
  List<AccountRecord> getProgramAccounts(AccountFilter filter);

  /**
   * One account by address.
   *
   * @param address the address
   * @return the optional
   */
  Optional<AccountRecord> getAccount(Address address);

  /**
   * Ids of every tree that belongs to the pool, full ones included.
   *
   * @param poolId the pool id
   * @return the list
   */
  List<Address> getTreeIds(Address poolId);

  /**
   * Current state of a tree.
   *
   * @param treeId the tree id
   * @return the merkle tree state
   */
  MerkleTreeState getTreeState(Address treeId);

  /**
   * Membership proof for a commitment against the tree's current root, if the commitment is in
   * that tree.
   *
   * @param treeId     the tree id
   * @param commitment the commitment
   * @return the optional
   */
  Optional<MerkleProof> findMerkleProof(Address treeId, byte[] commitment);

  /**
   * Whether the nullifier hash has been recorded.
   *
   * @param nullifierHash the nullifier hash
   * @return the boolean
   */
  boolean isNullifierSpent(byte[] nullifierHash);

  /**
   * Submits an operation and waits for confirmation.
   *
   * @param operation the operation
   * @return the submission receipt
   * @throws LedgerRejectionException when the ledger refuses the operation
   */
  SubmissionReceipt submitAndConfirm(LedgerOperation operation);
}
