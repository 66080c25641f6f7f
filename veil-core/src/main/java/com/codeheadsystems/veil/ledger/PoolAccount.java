package com.codeheadsystems.veil.ledger;

import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.TokenType;
import java.util.Objects;

/**
 * A pool: one fixed denomination of one token, feeding one tree at a time.
 *
 * @param poolId           the pool id
 * @param denomination     the denomination in base units
 * @param treeId           the tree currently receiving deposits
 * @param active           whether the pool accepts operations
 * @param totalDeposits    cumulative deposits
 * @param totalWithdrawals cumulative withdrawals
 * @param tokenType        the token type
 * @param maxFeeBasisPoints highest relayer fee the pool accepts
 */
public record PoolAccount(Address poolId,
                          long denomination,
                          Address treeId,
                          boolean active,
                          long totalDeposits,
                          long totalWithdrawals,
                          TokenType tokenType,
                          int maxFeeBasisPoints) {

  /**
   * Default maximum relayer fee, 2%.
   */
  public static final int DEFAULT_MAX_FEE_BPS = 200;

  /**
   * Instantiates a new Pool account.
   */
  public PoolAccount {
    Objects.requireNonNull(poolId, "poolId");
    Objects.requireNonNull(treeId, "treeId");
    Objects.requireNonNull(tokenType, "tokenType");
    if (denomination <= 0) {
      throw new IllegalArgumentException("denomination must be positive");
    }
    if (maxFeeBasisPoints < 0 || maxFeeBasisPoints > 10_000) {
      throw new IllegalArgumentException("maxFeeBasisPoints out of range: " + maxFeeBasisPoints);
    }
  }

  /**
   * Largest fee, in base units, a withdrawal from this pool may carry.
   *
   * @return the long
   */
  public long maxFee() {
    return Math.multiplyExact(denomination, (long) maxFeeBasisPoints) / 10_000L;
  }

  /**
   * Copy with updated counters.
   *
   * @param deposits    the deposits
   * @param withdrawals the withdrawals
   * @return the pool account
   */
  public PoolAccount withCounters(final long deposits, final long withdrawals) {
    return new PoolAccount(poolId, denomination, treeId, active, deposits, withdrawals, tokenType,
        maxFeeBasisPoints);
  }
}
