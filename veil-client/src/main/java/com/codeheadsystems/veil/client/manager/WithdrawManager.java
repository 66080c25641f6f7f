package com.codeheadsystems.veil.client.manager;

import com.codeheadsystems.veil.circuit.CircuitInputs;
import com.codeheadsystems.veil.client.accessor.LedgerAccessor;
import com.codeheadsystems.veil.client.config.VeilClientConfig;
import com.codeheadsystems.veil.client.model.CancellationToken;
import com.codeheadsystems.veil.client.model.ProofOutcome;
import com.codeheadsystems.veil.client.model.ProofProgressEvent;
import com.codeheadsystems.veil.client.model.SubmissionReceipt;
import com.codeheadsystems.veil.client.model.WithdrawResult;
import com.codeheadsystems.veil.client.model.WithdrawState;
import com.codeheadsystems.veil.commitment.CommitmentScheme;
import com.codeheadsystems.veil.exceptions.AlreadySpentException;
import com.codeheadsystems.veil.exceptions.InvalidRequestException;
import com.codeheadsystems.veil.exceptions.LedgerRejectionException;
import com.codeheadsystems.veil.exceptions.RelayerUnavailableException;
import com.codeheadsystems.veil.exceptions.StaleProofException;
import com.codeheadsystems.veil.exceptions.VeilException;
import com.codeheadsystems.veil.ledger.PoolAccount;
import com.codeheadsystems.veil.ledger.WithdrawOperation;
import com.codeheadsystems.veil.merkle.MerkleProof;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.DepositNote;
import com.codeheadsystems.veil.note.NoteCodec;
import com.codeheadsystems.veil.relayer.Relayer;
import com.codeheadsystems.veil.relayer.RelayerFilter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Withdraw state machine: IDLE, NOTE_PARSED, NULLIFIER_CHECKED, PROOF_GENERATED, SUBMITTED, then
 * CONFIRMED.
 * <p>
 * Cheap checks run before the proof. At most one withdrawal per note is in flight in this
 * client; a concurrent second call is refused before proof generation. A stale-root rejection
 * re-fetches the Merkle proof and regenerates, up to the configured bound. Failures are raised:
 * {@link AlreadySpentException} when the ledger has the nullifier, including a late rejection
 * after a local "unspent" answer, and {@link StaleProofException} when the bound is exhausted.
 * Cancellation is honoured up to submission and yields {@link WithdrawState#ABORTED}.
 */
@Singleton
public class WithdrawManager {
  private static final Logger log = LoggerFactory.getLogger(WithdrawManager.class);

  private final LedgerAccessor ledgerAccessor;
  private final PoolManager poolManager;
  private final MerkleTreeManager merkleTreeManager;
  private final NullifierManager nullifierManager;
  private final ProofManager proofManager;
  private final RelayerManager relayerManager;
  private final CommitmentScheme scheme;
  private final NoteCodec noteCodec;
  private final int staleRootAttempts;
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

  /**
   * Instantiates a new Withdraw manager.
   *
   * @param ledgerAccessor    the ledger accessor
   * @param poolManager       the pool manager
   * @param merkleTreeManager the merkle tree manager
   * @param nullifierManager  the nullifier manager
   * @param proofManager      the proof manager
   * @param relayerManager    the relayer manager
   * @param scheme            the commitment scheme
   * @param veilClientConfig  the veil client config
   */
  @Inject
  public WithdrawManager(final LedgerAccessor ledgerAccessor,
                         final PoolManager poolManager,
                         final MerkleTreeManager merkleTreeManager,
                         final NullifierManager nullifierManager,
                         final ProofManager proofManager,
                         final RelayerManager relayerManager,
                         final CommitmentScheme scheme,
                         final VeilClientConfig veilClientConfig) {
    log.info("WithdrawManager({}, staleRootAttempts={})", ledgerAccessor, veilClientConfig.staleRootAttempts());
    this.ledgerAccessor = ledgerAccessor;
    this.poolManager = poolManager;
    this.merkleTreeManager = merkleTreeManager;
    this.nullifierManager = nullifierManager;
    this.proofManager = proofManager;
    this.relayerManager = relayerManager;
    this.scheme = scheme;
    this.noteCodec = new NoteCodec(veilClientConfig.noteVersion());
    this.staleRootAttempts = veilClientConfig.staleRootAttempts();
  }

  /**
   * Self-paid withdrawal.
   *
   * @param noteString the note string
   * @param recipient  the recipient
   * @return the withdraw result
   */
  public WithdrawResult withdraw(final String noteString, final Address recipient) {
    return withdraw(noteString, recipient, null, null, CancellationToken.none(), null);
  }

  /**
   * Withdrawal, optionally through a relayer.
   *
   * @param noteString the note string
   * @param recipient  the recipient
   * @param relayer    the relayer, or null for a self-paid withdrawal
   * @param fee        the fee; null means the relayer's advertised fee, or zero without a relayer
   * @param token      cancellation token, honoured until submission
   * @param listener   proof progress listener, may be null
   * @return a CONFIRMED or ABORTED result
   */
  public WithdrawResult withdraw(final String noteString,
                                 final Address recipient,
                                 final Address relayer,
                                 final Long fee,
                                 final CancellationToken token,
                                 final Consumer<ProofProgressEvent> listener) {
    final List<WithdrawState> transitions = new ArrayList<>(List.of(WithdrawState.IDLE));
    final DepositNote note = noteCodec.decode(noteString);
    transitions.add(WithdrawState.NOTE_PARSED);
    if (recipient == null) {
      throw new InvalidRequestException("recipient is required");
    }
    final PoolAccount pool = requirePool(note);
    final long resolvedFee = resolveFee(pool, recipient, relayer, fee);

    final String nullifierHex = Hex.toHexString(scheme.nullifierHash(note));
    log.debug("withdraw(nullifierHash={}, relayer={}, fee={})", nullifierHex, relayer, resolvedFee);
    if (!inFlight.add(nullifierHex)) {
      throw new InvalidRequestException("A withdrawal for this note is already in progress",
          Map.of(VeilException.NULLIFIER_HASH, nullifierHex));
    }
    try {
      return spend(note, pool, nullifierHex, recipient, relayer, resolvedFee, token, listener, transitions);
    } finally {
      inFlight.remove(nullifierHex);
    }
  }

  /**
   * Withdrawal through the best scoring relayer whose fee the pool accepts. Falls back to a
   * self-paid withdrawal when no relayer qualifies or the registry cannot be read.
   *
   * @param noteString the note string
   * @param recipient  the recipient
   * @return the withdraw result
   */
  public WithdrawResult withdrawWithBestRelayer(final String noteString, final Address recipient) {
    final PoolAccount pool = requirePool(noteCodec.decode(noteString));
    final Relayer relayer;
    try {
      relayer = relayerManager.getBestRelayer(
          new RelayerFilter(pool.maxFeeBasisPoints() / 100.0, null, null));
    } catch (RelayerUnavailableException e) {
      log.warn("withdrawWithBestRelayer: no relayer available, withdrawing self-paid: {}", e.getMessage());
      return withdraw(noteString, recipient);
    } catch (VeilException e) {
      if (!e.isRetryable()) {
        throw e;
      }
      log.warn("withdrawWithBestRelayer: relayer registry unreadable, withdrawing self-paid: {}", e.getMessage());
      return withdraw(noteString, recipient);
    }
    return withdraw(noteString, recipient, relayer.address(), feeFor(pool, relayer), CancellationToken.none(),
        null);
  }

  /**
   * Whether a withdrawal for the note is running in this client.
   *
   * @param note the note
   * @return the boolean
   */
  public boolean isInFlight(final DepositNote note) {
    return inFlight.contains(Hex.toHexString(scheme.nullifierHash(note)));
  }

  private WithdrawResult spend(final DepositNote note,
                               final PoolAccount pool,
                               final String nullifierHex,
                               final Address recipient,
                               final Address relayer,
                               final long fee,
                               final CancellationToken token,
                               final Consumer<ProofProgressEvent> listener,
                               final List<WithdrawState> transitions) {
    if (nullifierManager.checkNullifier(scheme.nullifierHash(note))) {
      log.info("withdraw(nullifierHash={}) already spent", nullifierHex);
      throw new AlreadySpentException(nullifierHex);
    }
    transitions.add(WithdrawState.NULLIFIER_CHECKED);

    final byte[] commitment = scheme.commitment(note);
    StaleProofException lastStale = null;
    for (int attempt = 1; attempt <= staleRootAttempts; attempt++) {
      if (token.isCancelled()) {
        return aborted(nullifierHex, recipient, relayer, fee, attempt - 1, transitions);
      }
      final MerkleProof merkleProof = merkleTreeManager.getMerkleProof(pool.poolId(), commitment)
          .orElseThrow(() -> new InvalidRequestException("Commitment not found in any tree of the pool",
              Map.of(VeilException.COMMITMENT, Hex.toHexString(commitment),
                  VeilException.POOL_ID, pool.poolId().toHex())));
      final int depth = merkleTreeManager.getTreeState(merkleProof.treeId()).depth();
      final CircuitInputs inputs =
          proofManager.buildWithdrawalCircuitInputs(note, merkleProof, depth, recipient, relayer, fee);

      final ProofOutcome outcome = proofManager.generateProof(inputs, token, listener).await();
      if (outcome.aborted() || token.isCancelled()) {
        return aborted(nullifierHex, recipient, relayer, fee, attempt, transitions);
      }
      transitions.add(WithdrawState.PROOF_GENERATED);

      final WithdrawOperation operation = WithdrawOperation.fromProof(pool.poolId(), outcome.proof());
      transitions.add(WithdrawState.SUBMITTED);
      try {
        final SubmissionReceipt receipt = ledgerAccessor.submitAndConfirm(operation);
        transitions.add(WithdrawState.CONFIRMED);
        log.info("withdraw confirmed: nullifierHash={}, tx={}, attempts={}", nullifierHex,
            receipt.transactionId(), attempt);
        return new WithdrawResult(WithdrawState.CONFIRMED, nullifierHex, recipient,
            relayer, fee, receipt, attempt, true, List.copyOf(transitions));
      } catch (LedgerRejectionException e) {
        switch (e.reason()) {
          case NULLIFIER_ALREADY_SPENT:
            log.info("withdraw(nullifierHash={}) rejected as spent by the ledger", nullifierHex);
            throw new AlreadySpentException(nullifierHex, e);
          case INVALID_MERKLE_ROOT:
            proofManager.invalidateRoot(inputs.root());
            lastStale = StaleProofException.staleRoot(nullifierHex, attempt, e);
            log.warn("withdraw(nullifierHash={}) stale root on attempt {}/{}", nullifierHex, attempt,
                staleRootAttempts);
            break;
          default:
            throw e;
        }
      }
    }
    throw StaleProofException.exhausted(nullifierHex, staleRootAttempts, lastStale);
  }

  private PoolAccount requirePool(final DepositNote note) {
    final PoolAccount pool = poolManager.getPoolById(note.poolId())
        .orElseThrow(() -> new InvalidRequestException("Unknown pool",
            Map.of(VeilException.POOL_ID, note.poolId().toHex())));
    if (pool.denomination() != note.denomination() || pool.tokenType() != note.tokenType()) {
      throw new InvalidRequestException("Note does not match its pool's denomination or token",
          Map.of(VeilException.POOL_ID, pool.poolId().toHex()));
    }
    if (!pool.active()) {
      throw new InvalidRequestException("Pool is inactive", Map.of(VeilException.POOL_ID, pool.poolId().toHex()));
    }
    return pool;
  }

  private long resolveFee(final PoolAccount pool, final Address recipient, final Address relayer, final Long fee) {
    if (relayer == null) {
      if (fee != null && fee != 0) {
        throw new InvalidRequestException("A fee requires a relayer");
      }
      return 0L;
    }
    final long resolved;
    if (fee == null) {
      final Relayer record = relayerManager.getRelayer(relayer, false)
          .filter(Relayer::active)
          .orElseThrow(() -> new RelayerUnavailableException("Relayer is unknown or inactive: " + relayer, null));
      resolved = feeFor(pool, record);
    } else {
      resolved = fee;
    }
    if (resolved < 0) {
      throw new InvalidRequestException("Fee must not be negative");
    }
    if (resolved > pool.maxFee()) {
      throw new InvalidRequestException("Fee " + resolved + " exceeds the pool maximum " + pool.maxFee());
    }
    if (resolved > 0 && relayer.equals(recipient)) {
      throw new InvalidRequestException("A fee cannot be paid to the recipient");
    }
    return resolved;
  }

  private static long feeFor(final PoolAccount pool, final Relayer relayer) {
    return Math.multiplyExact(pool.denomination(), (long) relayer.feeBasisPoints()) / 10_000L;
  }

  private static WithdrawResult aborted(final String nullifierHex,
                                        final Address recipient,
                                        final Address relayer,
                                        final long fee,
                                        final int attempts,
                                        final List<WithdrawState> transitions) {
    log.debug("withdraw(nullifierHash={}) aborted before submission", nullifierHex);
    transitions.add(WithdrawState.ABORTED);
    return new WithdrawResult(WithdrawState.ABORTED, nullifierHex, recipient, relayer, fee, null, attempts, false,
        List.copyOf(transitions));
  }
}
