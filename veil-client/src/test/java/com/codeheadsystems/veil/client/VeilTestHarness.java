package com.codeheadsystems.veil.client;

import com.codeheadsystems.veil.client.accessor.DeterministicProverAccessor;
import com.codeheadsystems.veil.client.accessor.InMemoryLedgerAccessor;
import com.codeheadsystems.veil.client.config.VeilClientConfig;
import com.codeheadsystems.veil.client.model.DepositResult;
import com.codeheadsystems.veil.commitment.CommitmentScheme;
import com.codeheadsystems.veil.common.RandomProvider;
import com.codeheadsystems.veil.ledger.PoolAccount;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.TokenType;
import java.time.Clock;

/**
 * A client wired to an in-memory ledger holding one 1 SOL pool with a depth 4 tree, and to the
 * deterministic prover.
 */
public class VeilTestHarness implements AutoCloseable {

  public static final long ONE_SOL = 1_000_000_000L;
  public static final int DEPTH = 4;
  private static final RandomProvider RANDOM = new RandomProvider();

  private final CommitmentScheme scheme;
  private final InMemoryLedgerAccessor ledger;
  private final DeterministicProverAccessor prover;
  private final PoolAccount pool;
  private final VeilClient client;

  public VeilTestHarness() {
    this(VeilClientConfig.forTesting());
  }

  public VeilTestHarness(final VeilClientConfig config) {
    this.scheme = new CommitmentScheme(config.hashSuite());
    this.ledger = new InMemoryLedgerAccessor(scheme, DeterministicProverAccessor::accepts, Clock.systemUTC());
    this.prover = new DeterministicProverAccessor();
    this.pool = ledger.createPool(TokenType.SOL, ONE_SOL, DEPTH);
    this.client = new VeilClient(config, ledger, prover);
  }

  public static Address randomAddress() {
    return new Address(RANDOM.randomBytes(32));
  }

  public static byte[] randomLeaf() {
    return RANDOM.randomBytes(32);
  }

  /**
   * Deposits 1 SOL and returns the note string.
   *
   * @return the note string
   */
  public String depositOneSol() {
    final DepositResult result = client.depositManager().deposit(ONE_SOL, TokenType.SOL);
    if (!result.confirmed()) {
      throw new IllegalStateException("Harness deposit failed: " + result);
    }
    return result.noteString();
  }

  public CommitmentScheme scheme() {
    return scheme;
  }

  public InMemoryLedgerAccessor ledger() {
    return ledger;
  }

  public DeterministicProverAccessor prover() {
    return prover;
  }

  public PoolAccount pool() {
    return pool;
  }

  public VeilClient client() {
    return client;
  }

  @Override
  public void close() {
    client.close();
  }
}
