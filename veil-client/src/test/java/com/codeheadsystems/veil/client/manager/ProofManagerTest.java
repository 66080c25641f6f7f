package com.codeheadsystems.veil.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.veil.circuit.CircuitInputs;
import com.codeheadsystems.veil.client.accessor.DeterministicProverAccessor;
import com.codeheadsystems.veil.client.config.VeilClientConfig;
import com.codeheadsystems.veil.client.exceptions.ProverAccessorException;
import com.codeheadsystems.veil.client.model.CancellationToken;
import com.codeheadsystems.veil.client.model.ProofJob;
import com.codeheadsystems.veil.client.model.ProofOutcome;
import com.codeheadsystems.veil.client.model.ProofProgressEvent;
import com.codeheadsystems.veil.client.model.ProofStage;
import com.codeheadsystems.veil.client.store.ProofCache;
import com.codeheadsystems.veil.commitment.CommitmentScheme;
import com.codeheadsystems.veil.common.RandomProvider;
import com.codeheadsystems.veil.exceptions.InvalidCircuitInputException;
import com.codeheadsystems.veil.exceptions.ProofGenerationException;
import com.codeheadsystems.veil.merkle.IncrementalMerkleTree;
import com.codeheadsystems.veil.merkle.MerkleProof;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.DepositNote;
import com.codeheadsystems.veil.model.TokenType;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProofManagerTest {

  private static final int DEPTH = 4;
  private static final RandomProvider RANDOM = new RandomProvider();

  private final CommitmentScheme scheme = CommitmentScheme.DEFAULT;
  private DeterministicProverAccessor prover;
  private ProofCache proofCache;
  private ExecutorService executor;
  private ScheduledExecutorService scheduler;
  private ProofManager manager;
  private DepositNote note;
  private IncrementalMerkleTree tree;
  private Address recipient;

  @BeforeEach
  void setUp() {
    prover = new DeterministicProverAccessor();
    proofCache = new ProofCache(8);
    executor = Executors.newFixedThreadPool(2);
    scheduler = Executors.newSingleThreadScheduledExecutor();
    manager = managerWith(VeilClientConfig.forTesting());
    note = new DepositNote(new Address(RANDOM.randomBytes(32)), TokenType.SOL, 1_000_000_000L,
        RANDOM.randomBytes(32), RANDOM.randomBytes(32), 0L, null);
    tree = new IncrementalMerkleTree(Address.ZERO, DEPTH, scheme);
    tree.append(RANDOM.randomBytes(32));
    tree.append(scheme.commitment(note));
    recipient = new Address(RANDOM.randomBytes(32));
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
    scheduler.shutdownNow();
  }

  @Test
  void buildWithdrawalCircuitInputs_pathNotLeadingToRoot_rejectedBeforeProving() {
    MerkleProof honest = tree.proof(1);
    MerkleProof forged = new MerkleProof(honest.treeId(), RANDOM.randomBytes(32), honest.siblings(),
        honest.leafIndex());

    assertThatThrownBy(() -> manager.buildWithdrawalCircuitInputs(note, forged, DEPTH, recipient, null, 0L))
        .isInstanceOf(InvalidCircuitInputException.class)
        .hasMessageContaining("merkleProof");
    assertThat(prover.proveCalls()).isZero();
  }

  @Test
  void generateProof_reportsStagesInOrder() {
    ProofJob job = manager.generateProof(inputs(), new CancellationToken(), null);

    ProofOutcome outcome = job.await();

    assertThat(outcome.aborted()).isFalse();
    assertThat(outcome.fromCache()).isFalse();
    assertThat(job.events()).extracting(ProofProgressEvent::stage)
        .containsExactly(ProofStage.SETUP, ProofStage.WITNESS, ProofStage.PROVING, ProofStage.DONE);
  }

  @Test
  void generateProof_sameInputsTwice_secondServedFromCache() {
    CircuitInputs inputs = inputs();
    manager.generateProof(inputs, new CancellationToken(), null).await();

    ProofOutcome second = manager.generateProof(inputs, new CancellationToken(), null).await();

    assertThat(second.fromCache()).isTrue();
    assertThat(prover.proveCalls()).isEqualTo(1);
  }

  @Test
  void generateProof_afterRootInvalidated_provesAgain() {
    CircuitInputs inputs = inputs();
    manager.generateProof(inputs, new CancellationToken(), null).await();

    assertThat(manager.invalidateRoot(inputs.root())).isEqualTo(1);
    manager.generateProof(inputs, new CancellationToken(), null).await();

    assertThat(prover.proveCalls()).isEqualTo(2);
  }

  @Test
  void generateProof_cancelledBeforeStart_neverCallsProver() {
    CancellationToken token = new CancellationToken();
    token.cancel();

    ProofJob job = manager.generateProof(inputs(), token, null);

    assertThat(job.await().aborted()).isTrue();
    assertThat(job.events()).extracting(ProofProgressEvent::stage).containsExactly(ProofStage.ABORTED);
    assertThat(prover.proveCalls()).isZero();
  }

  @Test
  void generateProof_cancelledWhileProving_discardsOutput() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch gate = prover.hold(entered);
    ProofJob job = manager.generateProof(inputs(), new CancellationToken(), null);
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

    job.cancel();
    gate.countDown();

    assertThat(job.await().aborted()).isTrue();
    assertThat(proofCache.size()).isZero();
  }

  @Test
  void generateProof_cancelledBetweenStages_neverReachesProving() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch gate = prover.hold(entered);
    ProofJob job = manager.generateProof(inputs(), new CancellationToken(), null);
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

    job.cancel();
    gate.countDown();

    assertThat(job.await().aborted()).isTrue();
    assertThat(job.events()).extracting(ProofProgressEvent::stage)
        .containsExactly(ProofStage.SETUP, ProofStage.WITNESS, ProofStage.ABORTED);
  }

  @Test
  void generateProof_proofFailsLocalVerification_fails() {
    prover.corruptProofs(true);

    ProofJob job = manager.generateProof(inputs(), new CancellationToken(), null);

    assertThatThrownBy(job::await)
        .isInstanceOf(ProofGenerationException.class)
        .hasMessageContaining("does not verify");
    assertThat(job.events()).extracting(ProofProgressEvent::stage).endsWith(ProofStage.FAILED);
  }

  @Test
  void generateProof_proverUnreachable_failsWithNetworkError() {
    prover.failNext(1);

    assertThatThrownBy(() -> manager.generateProof(inputs(), new CancellationToken(), null).await())
        .isInstanceOf(ProverAccessorException.class);
  }

  @Test
  void generateProof_pastStallWarning_stillCompletes() throws Exception {
    VeilClientConfig base = VeilClientConfig.forTesting();
    ProofManager slowWarning = managerWith(new VeilClientConfig(base.relayerCacheTtl(), base.poolCacheTtl(),
        base.staleRootAttempts(), base.networkAttempts(), base.networkBackoff(), base.backoffMultiplier(),
        Duration.ofMillis(10), base.proofCacheEnabled(), base.proofCacheCapacity(), base.proverThreads(),
        base.relayerPingTimeout(), base.circuitArtifacts(), base.hashSuite(), base.relayerScoring(),
        base.noteVersion()));
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch gate = prover.hold(entered);
    ProofJob job = slowWarning.generateProof(inputs(), new CancellationToken(), null);
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

    Thread.sleep(50);
    gate.countDown();

    assertThat(job.await().aborted()).isFalse();
  }

  @Test
  void generateProof_executorShutDown_failsJob() {
    executor.shutdownNow();

    assertThatThrownBy(() -> manager.generateProof(inputs(), new CancellationToken(), null).await())
        .isInstanceOf(ProofGenerationException.class)
        .hasMessageContaining("shut down");
  }

  private CircuitInputs inputs() {
    return manager.buildWithdrawalCircuitInputs(note, tree.proof(1), DEPTH, recipient, null, 0L);
  }

  private ProofManager managerWith(final VeilClientConfig config) {
    return new ProofManager(prover, config, proofCache, executor, scheduler, scheme, Clock.systemUTC());
  }
}
