package com.codeheadsystems.veil.ledger;

import com.codeheadsystems.veil.common.ByteUtils;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.relayer.Relayer;

/**
 * Fixed-offset layout of relayer accounts.
 * <pre>
 *  0  discriminator (2)     32  active (0|1)          34  fee bps u16 LE
 * 36  volume u64 LE         44  fees u64 LE           52  success rate u16 LE (1/100 %)
 * 54  response time u16 LE (ms)                        size 80
 * </pre>
 * Volume is in base units, 1e9 per whole unit. A u16 metric of 0xFFFF means "not measured".
 * Offsets are provisional until checked against the deployed program.
 */
public final class RelayerAccountLayout {

  public static final int DISCRIMINATOR = 2;
  public static final int SIZE = 80;
  public static final AccountFilter FILTER = new AccountFilter(DISCRIMINATOR, SIZE);
  /**
   * Sentinel for an unmeasured u16 metric.
   */
  public static final int UNKNOWN = 0xFFFF;

  private static final int ACTIVE = 32;
  private static final int FEE_BPS = 34;
  private static final int VOLUME = 36;
  private static final int FEES = 44;
  private static final int SUCCESS_RATE = 52;
  private static final int RESPONSE_TIME = 54;
  private static final double BASE_UNITS_PER_WHOLE = 1_000_000_000.0;

  private RelayerAccountLayout() {
  }

  /**
   * Decode.
   *
   * @param account the account
   * @return the relayer
   */
  public static Relayer decode(final AccountRecord account) {
    final byte[] data = account.data();
    if (!FILTER.matches(data)) {
      throw new IllegalArgumentException("Not a relayer account: " + account.address());
    }
    final int success = ByteUtils.readU16(data, SUCCESS_RATE);
    final int response = ByteUtils.readU16(data, RESPONSE_TIME);
    return new Relayer(account.address(),
        ByteUtils.readU16(data, FEE_BPS) / 100.0,
        data[ACTIVE] != 0,
        ByteUtils.readU64(data, VOLUME) / BASE_UNITS_PER_WHOLE,
        ByteUtils.readU64(data, FEES),
        success == UNKNOWN ? null : success / 100.0,
        response == UNKNOWN ? null : response);
  }

  /**
   * Encode.
   *
   * @param relayer the relayer
   * @return the account record
   */
  public static AccountRecord encode(final Relayer relayer) {
    final byte[] data = new byte[SIZE];
    data[0] = (byte) DISCRIMINATOR;
    data[ACTIVE] = (byte) (relayer.active() ? 1 : 0);
    ByteUtils.writeU16(data, FEE_BPS, relayer.feeBasisPoints());
    ByteUtils.writeU64(data, VOLUME, Math.round(relayer.totalVolume() * BASE_UNITS_PER_WHOLE));
    ByteUtils.writeU64(data, FEES, relayer.totalFees());
    ByteUtils.writeU16(data, SUCCESS_RATE, relayer.successRatePercent() == null
        ? UNKNOWN
        : (int) Math.round(relayer.successRatePercent() * 100.0));
    ByteUtils.writeU16(data, RESPONSE_TIME, relayer.responseTimeMs() == null
        ? UNKNOWN
        : Math.min(UNKNOWN - 1, relayer.responseTimeMs()));
    return new AccountRecord(relayer.address(), data);
  }
}
