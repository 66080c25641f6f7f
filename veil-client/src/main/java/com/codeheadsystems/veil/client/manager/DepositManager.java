package com.codeheadsystems.veil.client.manager;

import com.codeheadsystems.veil.client.accessor.LedgerAccessor;
import com.codeheadsystems.veil.client.config.VeilClientConfig;
import com.codeheadsystems.veil.client.model.CancellationToken;
import com.codeheadsystems.veil.client.model.DepositResult;
import com.codeheadsystems.veil.client.model.DepositState;
import com.codeheadsystems.veil.client.model.SubmissionReceipt;
import com.codeheadsystems.veil.commitment.CommitmentScheme;
import com.codeheadsystems.veil.commitment.SecretGenerator;
import com.codeheadsystems.veil.exceptions.LedgerAccessException;
import com.codeheadsystems.veil.exceptions.VeilException;
import com.codeheadsystems.veil.ledger.DepositOperation;
import com.codeheadsystems.veil.ledger.PoolAccount;
import com.codeheadsystems.veil.merkle.MerkleTreeState;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.DepositNote;
import com.codeheadsystems.veil.model.TokenType;
import com.codeheadsystems.veil.note.NoteCodec;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deposit state machine: IDLE, NOTE_GENERATED, TREE_SELECTED, COMMITMENT_SUBMITTED, then
 * CONFIRMED or FAILED.
 * <p>
 * Once a note exists and the submission has been attempted, the note is always handed back. A
 * failed submission may still have moved funds, so the caller keeps the note and uses
 * {@link #isDeposited(DepositNote)} or {@link #resubmit(DepositNote)}.
 */
@Singleton
public class DepositManager {
  private static final Logger log = LoggerFactory.getLogger(DepositManager.class);

  private final LedgerAccessor ledgerAccessor;
  private final PoolManager poolManager;
  private final MerkleTreeManager merkleTreeManager;
  private final SecretGenerator secretGenerator;
  private final CommitmentScheme scheme;
  private final NoteCodec noteCodec;
  private final Clock clock;

  /**
   * Instantiates a new Deposit manager.
   *
   * @param ledgerAccessor    the ledger accessor
   * @param poolManager       the pool manager
   * @param merkleTreeManager the merkle tree manager
   * @param secretGenerator   the secret generator
   * @param scheme            the commitment scheme
   * @param veilClientConfig  the veil client config
   * @param clock             the clock
   */
  @Inject
  public DepositManager(final LedgerAccessor ledgerAccessor,
                        final PoolManager poolManager,
                        final MerkleTreeManager merkleTreeManager,
                        final SecretGenerator secretGenerator,
                        final CommitmentScheme scheme,
                        final VeilClientConfig veilClientConfig,
                        final Clock clock) {
    log.info("DepositManager({}, {})", ledgerAccessor, veilClientConfig.noteVersion());
    this.ledgerAccessor = ledgerAccessor;
    this.poolManager = poolManager;
    this.merkleTreeManager = merkleTreeManager;
    this.secretGenerator = secretGenerator;
    this.scheme = scheme;
    this.noteCodec = new NoteCodec(veilClientConfig.noteVersion());
    this.clock = clock;
  }

  /**
   * Deposit into the pool for the amount and token, without a bound recipient.
   *
   * @param amount    the amount, which must be a pool denomination
   * @param tokenType the token type
   * @return the deposit result
   */
  public DepositResult deposit(final long amount, final TokenType tokenType) {
    return deposit(amount, tokenType, null, CancellationToken.none());
  }

  /**
   * Deposit.
   *
   * @param amount    the amount, which must be a pool denomination
   * @param tokenType the token type
   * @param recipient recipient to bind into the commitment, or null
   * @param token     cancellation token, honoured until submission
   * @return the deposit result
   * @throws com.codeheadsystems.veil.exceptions.InvalidRequestException   if no pool matches
   * @throws com.codeheadsystems.veil.exceptions.NoAvailableTreeException if every tree is full
   */
  public DepositResult deposit(final long amount,
                               final TokenType tokenType,
                               final Address recipient,
                               final CancellationToken token) {
    log.debug("deposit(amount={}, token={}, bound={})", amount, tokenType, recipient != null);
    final List<DepositState> transitions = new ArrayList<>(List.of(DepositState.IDLE));
    final PoolAccount pool = poolManager.getPool(amount, tokenType);
    if (token.isCancelled()) {
      return aborted(transitions);
    }

    final DepositNote note = new DepositNote(pool.poolId(), tokenType, pool.denomination(),
        secretGenerator.generateSecret(), secretGenerator.generateNullifierPreimage(),
        clock.millis(), recipient);
    transitions.add(DepositState.NOTE_GENERATED);
    return submit(note, transitions, token);
  }

  /**
   * Retries an unconfirmed deposit with the same note. A note whose commitment is already in a
   * tree is reported confirmed without a second submission.
   *
   * @param note the note
   * @return the deposit result
   */
  public DepositResult resubmit(final DepositNote note) {
    final String commitment = Hex.toHexString(scheme.commitment(note));
    log.debug("resubmit(commitment={})", commitment);
    final List<DepositState> transitions = new ArrayList<>(List.of(DepositState.IDLE, DepositState.NOTE_GENERATED));
    if (isDeposited(note)) {
      log.info("resubmit(commitment={}) already on the ledger", commitment);
      transitions.add(DepositState.CONFIRMED);
      return new DepositResult(DepositState.CONFIRMED, note, noteCodec.encode(note), commitment, null, null, null,
          false, List.copyOf(transitions));
    }
    return submit(note, transitions, CancellationToken.none());
  }

  /**
   * Whether the note's commitment is present in any tree of its pool.
   *
   * @param note the note
   * @return the boolean
   */
  public boolean isDeposited(final DepositNote note) {
    return merkleTreeManager.getMerkleProof(note.poolId(), scheme.commitment(note)).isPresent();
  }

  private DepositResult submit(final DepositNote note,
                               final List<DepositState> transitions,
                               final CancellationToken token) {
    final byte[] commitment = scheme.commitment(note);
    final String commitmentHex = Hex.toHexString(commitment);
    final MerkleTreeState tree = merkleTreeManager.pickTreeForDeposit(note.poolId());
    transitions.add(DepositState.TREE_SELECTED);
    if (token.isCancelled()) {
      return aborted(transitions);
    }

    final DepositOperation operation =
        new DepositOperation(note.denomination(), commitment, tree.treeId(), note.poolId());
    transitions.add(DepositState.COMMITMENT_SUBMITTED);
    final String noteString = noteCodec.encode(note);
    try {
      final SubmissionReceipt receipt = ledgerAccessor.submitAndConfirm(operation);
      transitions.add(DepositState.CONFIRMED);
      log.info("deposit confirmed: commitment={}, tree={}, tx={}", commitmentHex, tree.treeId(),
          receipt.transactionId());
      return new DepositResult(DepositState.CONFIRMED, note, noteString, commitmentHex, tree.treeId(), receipt,
          null, true, List.copyOf(transitions));
    } catch (VeilException e) {
      return unconfirmed(note, noteString, commitmentHex, tree, e, transitions);
    } catch (RuntimeException e) {
      // Outcome unknown; the note still goes back to the caller.
      return unconfirmed(note, noteString, commitmentHex, tree,
          new LedgerAccessException("Deposit submission failed: " + e.getMessage(), e), transitions);
    }
  }

  private DepositResult unconfirmed(final DepositNote note,
                                    final String noteString,
                                    final String commitmentHex,
                                    final MerkleTreeState tree,
                                    final VeilException error,
                                    final List<DepositState> transitions) {
    log.warn("deposit unconfirmed: commitment={}, tree={}: {}", commitmentHex, tree.treeId(), error.getMessage());
    transitions.add(DepositState.FAILED);
    return new DepositResult(DepositState.FAILED, note, noteString, commitmentHex, tree.treeId(), null,
        error, true, List.copyOf(transitions));
  }

  private DepositResult aborted(final List<DepositState> transitions) {
    log.debug("deposit aborted before submission");
    transitions.add(DepositState.ABORTED);
    return new DepositResult(DepositState.ABORTED, null, null, null, null, null, null, false,
        List.copyOf(transitions));
  }
}
