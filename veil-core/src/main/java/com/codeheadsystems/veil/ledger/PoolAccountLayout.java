package com.codeheadsystems.veil.ledger;

import com.codeheadsystems.veil.common.ByteUtils;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.TokenType;

/**
 * Fixed-offset layout of pool accounts.
 * <pre>
 *  0  discriminator (1)       8  denomination u64 LE   16  treeId[32]
 * 48  active (0|1)           49  deposits u64 LE       57  withdrawals u64 LE
 * 65  token code             66  max fee bps u16 LE    size 128
 * </pre>
 * Offsets are provisional until checked against the deployed program.
 */
public final class PoolAccountLayout {

  public static final int DISCRIMINATOR = 1;
  public static final int SIZE = 128;
  public static final AccountFilter FILTER = new AccountFilter(DISCRIMINATOR, SIZE);

  private static final int DENOMINATION = 8;
  private static final int TREE_ID = 16;
  private static final int ACTIVE = 48;
  private static final int DEPOSITS = 49;
  private static final int WITHDRAWALS = 57;
  private static final int TOKEN = 65;
  private static final int MAX_FEE = 66;

  private PoolAccountLayout() {
  }

  /**
   * Decode.
   *
   * @param account the account
   * @return the pool account
   */
  public static PoolAccount decode(final AccountRecord account) {
    final byte[] data = account.data();
    if (!FILTER.matches(data)) {
      throw new IllegalArgumentException("Not a pool account: " + account.address());
    }
    return new PoolAccount(account.address(),
        ByteUtils.readU64(data, DENOMINATION),
        new Address(ByteUtils.slice(data, TREE_ID, ByteUtils.FIELD_LENGTH)),
        data[ACTIVE] != 0,
        ByteUtils.readU64(data, DEPOSITS),
        ByteUtils.readU64(data, WITHDRAWALS),
        TokenType.fromCode(data[TOKEN] & 0xFF),
        ByteUtils.readU16(data, MAX_FEE));
  }

  /**
   * Encode.
   *
   * @param pool the pool
   * @return the account record
   */
  public static AccountRecord encode(final PoolAccount pool) {
    final byte[] data = new byte[SIZE];
    data[0] = (byte) DISCRIMINATOR;
    ByteUtils.writeU64(data, DENOMINATION, pool.denomination());
    System.arraycopy(pool.treeId().bytes(), 0, data, TREE_ID, ByteUtils.FIELD_LENGTH);
    data[ACTIVE] = (byte) (pool.active() ? 1 : 0);
    ByteUtils.writeU64(data, DEPOSITS, pool.totalDeposits());
    ByteUtils.writeU64(data, WITHDRAWALS, pool.totalWithdrawals());
    data[TOKEN] = (byte) pool.tokenType().code();
    ByteUtils.writeU16(data, MAX_FEE, pool.maxFeeBasisPoints());
    return new AccountRecord(pool.poolId(), data);
  }
}
