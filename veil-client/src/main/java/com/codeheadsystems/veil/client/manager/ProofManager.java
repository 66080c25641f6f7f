package com.codeheadsystems.veil.client.manager;

import com.codeheadsystems.veil.circuit.CircuitInputBuilder;
import com.codeheadsystems.veil.circuit.CircuitInputs;
import com.codeheadsystems.veil.circuit.PublicSignals;
import com.codeheadsystems.veil.circuit.WithdrawalProof;
import com.codeheadsystems.veil.client.accessor.ProverAccessor;
import com.codeheadsystems.veil.client.config.VeilClientConfig;
import com.codeheadsystems.veil.client.model.CancellationToken;
import com.codeheadsystems.veil.client.model.ProofJob;
import com.codeheadsystems.veil.client.model.ProofOutcome;
import com.codeheadsystems.veil.client.model.ProofProgressEvent;
import com.codeheadsystems.veil.client.model.ProofStage;
import com.codeheadsystems.veil.client.store.ProofCache;
import com.codeheadsystems.veil.commitment.CommitmentScheme;
import com.codeheadsystems.veil.exceptions.InvalidCircuitInputException;
import com.codeheadsystems.veil.exceptions.ProofGenerationException;
import com.codeheadsystems.veil.exceptions.VeilException;
import com.codeheadsystems.veil.merkle.MerkleProof;
import com.codeheadsystems.veil.merkle.MerkleProofVerifier;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.DepositNote;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles circuit inputs and drives the external prover.
 * <p>
 * Input validation runs before any prover call. Generation is asynchronous and cancellable at
 * defined check points; a cancelled job discards whatever the prover returned. Finished proofs
 * are cached by input fingerprint and never reused across roots.
 */
@Singleton
public class ProofManager {
  private static final Logger log = LoggerFactory.getLogger(ProofManager.class);

  private final ProverAccessor proverAccessor;
  private final VeilClientConfig veilClientConfig;
  private final ProofCache proofCache;
  private final ExecutorService proverExecutor;
  private final ScheduledExecutorService scheduler;
  private final CommitmentScheme scheme;
  private final CircuitInputBuilder circuitInputBuilder;
  private final MerkleProofVerifier merkleProofVerifier;
  private final Clock clock;

  /**
   * Instantiates a new Proof manager.
   *
   * @param proverAccessor   the prover accessor
   * @param veilClientConfig the veil client config
   * @param proofCache       the proof cache
   * @param proverExecutor   runs proof jobs
   * @param scheduler        runs stall warnings
   * @param scheme           the commitment scheme
   * @param clock            the clock
   */
  @Inject
  public ProofManager(final ProverAccessor proverAccessor,
                      final VeilClientConfig veilClientConfig,
                      final ProofCache proofCache,
                      final ExecutorService proverExecutor,
                      final ScheduledExecutorService scheduler,
                      final CommitmentScheme scheme,
                      final Clock clock) {
    log.info("ProofManager({}, {})", proverAccessor, veilClientConfig.circuitArtifacts());
    this.proverAccessor = proverAccessor;
    this.veilClientConfig = veilClientConfig;
    this.proofCache = proofCache;
    this.proverExecutor = proverExecutor;
    this.scheduler = scheduler;
    this.scheme = scheme;
    this.circuitInputBuilder = new CircuitInputBuilder(scheme);
    this.merkleProofVerifier = new MerkleProofVerifier(scheme);
    this.clock = clock;
  }

  /**
   * Validates the Merkle path against the note's commitment, then assembles the input vector.
   *
   * @param note        the note
   * @param merkleProof the merkle proof
   * @param treeDepth   the tree depth
   * @param recipient   the recipient
   * @param relayer     the relayer, null when self-paid
   * @param fee         the fee
   * @return the circuit inputs
   * @throws InvalidCircuitInputException when the path or any field is malformed
   */
  public CircuitInputs buildWithdrawalCircuitInputs(final DepositNote note,
                                                    final MerkleProof merkleProof,
                                                    final int treeDepth,
                                                    final Address recipient,
                                                    final Address relayer,
                                                    final long fee) {
    log.debug("buildWithdrawalCircuitInputs(tree={}, leafIndex={}, fee={})",
        merkleProof == null ? null : merkleProof.treeId(),
        merkleProof == null ? null : merkleProof.leafIndex(), fee);
    final CircuitInputs inputs = circuitInputBuilder.build(note, merkleProof, treeDepth, recipient, relayer, fee);
    if (!merkleProofVerifier.verify(scheme.commitment(note), merkleProof)) {
      throw new InvalidCircuitInputException("merkleProof", "path does not lead to root "
          + Hex.toHexString(merkleProof.root()));
    }
    return inputs;
  }

  /**
   * Starts proof generation.
   *
   * @param inputs   the inputs
   * @param token    the cancellation token
   * @param listener progress listener, may be null
   * @return the proof job
   */
  public ProofJob generateProof(final CircuitInputs inputs,
                                final CancellationToken token,
                                final Consumer<ProofProgressEvent> listener) {
    final ProofJob job = new ProofJob(UUID.randomUUID().toString(), token, listener, clock);
    final String fingerprint = ProofCache.fingerprint(inputs);
    log.debug("generateProof(job={}, fingerprint={})", job.jobId(), fingerprint);

    if (veilClientConfig.proofCacheEnabled()) {
      final Optional<WithdrawalProof> cached = proofCache.get(fingerprint, inputs.root());
      if (cached.isPresent()) {
        log.trace("generateProof(job={}) cache hit", job.jobId());
        job.complete(new ProofOutcome(cached.get(), true));
        return job;
      }
    }
    try {
      proverExecutor.execute(() -> runJob(job, inputs, fingerprint));
    } catch (RejectedExecutionException e) {
      job.fail(new ProofGenerationException("Prover executor is shut down", e));
      return job;
    }
    final ScheduledFuture<?> stallWarning = scheduler.schedule(() -> {
      if (!job.result().isDone()) {
        log.warn("generateProof(job={}) still running after {}", job.jobId(), veilClientConfig.proofStallWarning());
      }
    }, veilClientConfig.proofStallWarning().toMillis(), TimeUnit.MILLISECONDS);
    job.result().whenComplete((outcome, failure) -> stallWarning.cancel(false));
    return job;
  }

  /**
   * Local verification before anything reaches the ledger.
   *
   * @param proof           the proof
   * @param expectedSignals the signals the proof must carry
   * @return true when the signals match and the proof verifies
   */
  public boolean verifyProof(final WithdrawalProof proof, final PublicSignals expectedSignals) {
    if (!proof.signals().equals(expectedSignals)) {
      log.warn("verifyProof: public signals do not match the inputs");
      return false;
    }
    final boolean valid = proverAccessor.verify(proof, veilClientConfig.circuitArtifacts());
    log.debug("verifyProof(nullifierHash={}) -> {}", Hex.toHexString(expectedSignals.nullifierHash()), valid);
    return valid;
  }

  /**
   * Drops cached proofs for a root the ledger no longer accepts.
   *
   * @param root the root
   * @return entries dropped
   */
  public int invalidateRoot(final byte[] root) {
    return proofCache.invalidateRoot(root);
  }

  private void runJob(final ProofJob job, final CircuitInputs inputs, final String fingerprint) {
    try {
      if (abortIfCancelled(job, ProofStage.SETUP)) {
        return;
      }
      job.publish(ProofStage.SETUP, veilClientConfig.circuitArtifacts().circuitId());
      final WithdrawalProof proof = proverAccessor.prove(inputs, veilClientConfig.circuitArtifacts(),
          stage -> {
            if (job.token().isCancelled()) {
              throw new CancellationException("Cancelled before " + stage);
            }
            job.publish(stage, "");
          });
      if (abortIfCancelled(job, ProofStage.PROVING)) {
        return;
      }
      if (!verifyProof(proof, inputs.expectedSignals())) {
        job.fail(new ProofGenerationException("Prover returned a proof that does not verify",
            Map.of(VeilException.NULLIFIER_HASH, Hex.toHexString(inputs.nullifierHash())), null));
        return;
      }
      if (veilClientConfig.proofCacheEnabled()) {
        proofCache.put(fingerprint, proof);
      }
      job.complete(new ProofOutcome(proof, false));
    } catch (CancellationException e) {
      log.debug("runJob(job={}) {}", job.jobId(), e.getMessage());
      job.complete(ProofOutcome.ABORTED);
    } catch (VeilException e) {
      log.debug("runJob(job={}) failed: {}", job.jobId(), e.getMessage());
      job.fail(e);
    } catch (RuntimeException e) {
      job.fail(new ProofGenerationException("Proof generation failed", e));
    }
  }

  private boolean abortIfCancelled(final ProofJob job, final ProofStage checkpoint) {
    if (job.token().isCancelled()) {
      log.debug("runJob(job={}) cancelled at {}", job.jobId(), checkpoint);
      job.complete(ProofOutcome.ABORTED);
      return true;
    }
    return false;
  }
}
