package com.codeheadsystems.veil.client.config;

import com.codeheadsystems.veil.client.exceptions.ProverAccessorException;
import com.codeheadsystems.veil.commitment.HashSuite;
import com.codeheadsystems.veil.exceptions.LedgerAccessException;
import com.codeheadsystems.veil.note.NoteVersion;
import com.codeheadsystems.veil.relayer.RelayerScoring;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;

/**
 * Client-side tunables.
 * <p>
 * The hash suite and circuit artifacts must match the deployed circuit or every proof the client
 * produces will be rejected. Everything else is local policy.
 * <p>
 * For tests use {@link #forTesting()}, which keeps back-off and stall warnings short.
 *
 * @param relayerCacheTtl    how long a relayer list stays fresh
 * @param poolCacheTtl       how long a pool list stays fresh
 * @param staleRootAttempts  proofs submitted per withdrawal before a stale root is fatal, including the first
 * @param networkAttempts    attempts per ledger read, including the first
 * @param networkBackoff     initial wait between read attempts
 * @param backoffMultiplier  growth factor for the wait
 * @param proofStallWarning  when to warn that a proof is taking long; never cancels
 * @param proofCacheEnabled  whether finished proofs are cached by input fingerprint
 * @param proofCacheCapacity entries kept in the proof cache
 * @param proverThreads      concurrent proof generations
 * @param relayerPingTimeout relayer ping timeout
 * @param circuitArtifacts   the circuit artifacts
 * @param hashSuite          the hash suite of the deployed circuit
 * @param relayerScoring     relayer score coefficients
 * @param noteVersion        the note format written for new deposits
 */
public record VeilClientConfig(Duration relayerCacheTtl,
                               Duration poolCacheTtl,
                               int staleRootAttempts,
                               int networkAttempts,
                               Duration networkBackoff,
                               double backoffMultiplier,
                               Duration proofStallWarning,
                               boolean proofCacheEnabled,
                               int proofCacheCapacity,
                               int proverThreads,
                               Duration relayerPingTimeout,
                               CircuitArtifacts circuitArtifacts,
                               HashSuite hashSuite,
                               RelayerScoring relayerScoring,
                               NoteVersion noteVersion) {

  /**
   * Instantiates a new Veil client config.
   */
  public VeilClientConfig {
    if (staleRootAttempts < 1) {
      throw new IllegalArgumentException("staleRootAttempts must be at least 1");
    }
    if (networkAttempts < 1) {
      throw new IllegalArgumentException("networkAttempts must be at least 1");
    }
    if (proofCacheCapacity < 1 || proverThreads < 1) {
      throw new IllegalArgumentException("proofCacheCapacity and proverThreads must be positive");
    }
  }

  /**
   * Production defaults.
   */
  public VeilClientConfig() {
    this(Duration.ofSeconds(60), Duration.ofSeconds(60), 3, 3, Duration.ofMillis(200), 2.0,
        Duration.ofSeconds(30), true, 64, 2, Duration.ofSeconds(5), CircuitArtifacts.DEFAULT,
        HashSuite.SHA256, RelayerScoring.DEFAULT, NoteVersion.V2);
  }

  /**
   * Test defaults: 1 ms back-off, short ping timeout. Do not use in production.
   *
   * @return the veil client config
   */
  public static VeilClientConfig forTesting() {
    return new VeilClientConfig(Duration.ofSeconds(60), Duration.ofSeconds(60), 3, 3, Duration.ofMillis(1), 1.0,
        Duration.ofSeconds(30), true, 16, 4, Duration.ofMillis(500), CircuitArtifacts.DEFAULT,
        HashSuite.SHA256, RelayerScoring.DEFAULT, NoteVersion.V2);
  }

  /**
   * Retry applied to ledger and prover reads. Only transient failures are retried.
   *
   * @param name the retry name, used in logs
   * @return the retry
   */
  public Retry readRetry(final String name) {
    final RetryConfig retryConfig = RetryConfig.custom()
        .maxAttempts(networkAttempts)
        .intervalFunction(IntervalFunction.ofExponentialBackoff(networkBackoff, backoffMultiplier))
        .retryExceptions(LedgerAccessException.class, ProverAccessorException.class)
        .build();
    return Retry.of(name, retryConfig);
  }
}
