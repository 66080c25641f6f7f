package com.codeheadsystems.veil.client;

import com.codeheadsystems.veil.client.accessor.LedgerAccessor;
import com.codeheadsystems.veil.client.accessor.ProverAccessor;
import com.codeheadsystems.veil.client.config.VeilClientConfig;
import com.codeheadsystems.veil.client.manager.DepositManager;
import com.codeheadsystems.veil.client.manager.MerkleTreeManager;
import com.codeheadsystems.veil.client.manager.NullifierManager;
import com.codeheadsystems.veil.client.manager.PoolManager;
import com.codeheadsystems.veil.client.manager.ProofManager;
import com.codeheadsystems.veil.client.manager.RelayerManager;
import com.codeheadsystems.veil.client.manager.WithdrawManager;
import com.codeheadsystems.veil.client.store.ProofCache;
import com.codeheadsystems.veil.commitment.CommitmentScheme;
import com.codeheadsystems.veil.commitment.SecretGenerator;
import com.codeheadsystems.veil.common.RandomProvider;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the managers for one ledger handle and owns the pool, relayer and proof caches and the
 * executors. Trees are not cached. Close it to stop the proof and ping threads.
 */
public class VeilClient implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(VeilClient.class);

  private final ExecutorService proverExecutor;
  private final ExecutorService pingExecutor;
  private final ScheduledExecutorService scheduler;
  private final ProofCache proofCache;
  private final CommitmentScheme scheme;
  private final PoolManager poolManager;
  private final MerkleTreeManager merkleTreeManager;
  private final NullifierManager nullifierManager;
  private final ProofManager proofManager;
  private final RelayerManager relayerManager;
  private final DepositManager depositManager;
  private final WithdrawManager withdrawManager;

  /**
   * Instantiates a new Veil client with the system clock and a default random provider.
   *
   * @param veilClientConfig the veil client config
   * @param ledgerAccessor   the ledger accessor
   * @param proverAccessor   the prover accessor
   */
  public VeilClient(final VeilClientConfig veilClientConfig,
                    final LedgerAccessor ledgerAccessor,
                    final ProverAccessor proverAccessor) {
    this(veilClientConfig, ledgerAccessor, proverAccessor, new RandomProvider(), Clock.systemUTC());
  }

  /**
   * Instantiates a new Veil client.
   *
   * @param veilClientConfig the veil client config
   * @param ledgerAccessor   the ledger accessor
   * @param proverAccessor   the prover accessor
   * @param randomProvider   the random provider for note secrets
   * @param clock            the clock
   */
  public VeilClient(final VeilClientConfig veilClientConfig,
                    final LedgerAccessor ledgerAccessor,
                    final ProverAccessor proverAccessor,
                    final RandomProvider randomProvider,
                    final Clock clock) {
    log.info("VeilClient({}, {}, {})", ledgerAccessor, proverAccessor, veilClientConfig.hashSuite());
    this.proverExecutor = Executors.newFixedThreadPool(veilClientConfig.proverThreads(), daemonThreads("veil-prover"));
    this.pingExecutor = Executors.newCachedThreadPool(daemonThreads("veil-ping"));
    this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("veil-stall"));
    this.proofCache = new ProofCache(veilClientConfig.proofCacheCapacity());
    this.scheme = new CommitmentScheme(veilClientConfig.hashSuite());

    this.poolManager = new PoolManager(ledgerAccessor, veilClientConfig, clock);
    this.merkleTreeManager = new MerkleTreeManager(ledgerAccessor, veilClientConfig);
    this.nullifierManager = new NullifierManager(ledgerAccessor, veilClientConfig);
    this.proofManager = new ProofManager(proverAccessor, veilClientConfig, proofCache, proverExecutor, scheduler,
        scheme, clock);
    this.relayerManager = new RelayerManager(ledgerAccessor, veilClientConfig, pingExecutor, clock);
    this.depositManager = new DepositManager(ledgerAccessor, poolManager, merkleTreeManager,
        new SecretGenerator(randomProvider), scheme, veilClientConfig, clock);
    this.withdrawManager = new WithdrawManager(ledgerAccessor, poolManager, merkleTreeManager, nullifierManager,
        proofManager, relayerManager, scheme, veilClientConfig);
  }

  public CommitmentScheme commitmentScheme() {
    return scheme;
  }

  public PoolManager poolManager() {
    return poolManager;
  }

  public MerkleTreeManager merkleTreeManager() {
    return merkleTreeManager;
  }

  public NullifierManager nullifierManager() {
    return nullifierManager;
  }

  public ProofManager proofManager() {
    return proofManager;
  }

  public RelayerManager relayerManager() {
    return relayerManager;
  }

  public DepositManager depositManager() {
    return depositManager;
  }

  public WithdrawManager withdrawManager() {
    return withdrawManager;
  }

  @Override
  public void close() {
    log.info("close()");
    proverExecutor.shutdownNow();
    pingExecutor.shutdownNow();
    scheduler.shutdownNow();
    proofCache.clear();
    poolManager.clear();
    relayerManager.clear();
  }

  private static ThreadFactory daemonThreads(final String prefix) {
    final AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      final Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
