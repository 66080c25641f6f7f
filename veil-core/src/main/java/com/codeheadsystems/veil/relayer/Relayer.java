package com.codeheadsystems.veil.relayer;

import com.codeheadsystems.veil.model.Address;
import java.util.Objects;

/**
 * Snapshot of one relayer's on-ledger record.
 *
 * @param address             the relayer address
 * @param feePercent          fee charged, in percent of the withdrawn amount
 * @param active              whether the relayer accepts work
 * @param totalVolume         cumulative relayed volume, in whole units
 * @param totalFees           cumulative fees earned, in base units
 * @param successRatePercent  success rate in percent, or null when unknown
 * @param responseTimeMs      average response time in milliseconds, or null when unknown
 */
public record Relayer(Address address,
                      double feePercent,
                      boolean active,
                      double totalVolume,
                      long totalFees,
                      Double successRatePercent,
                      Integer responseTimeMs) {

  /**
   * Instantiates a new Relayer.
   */
  public Relayer {
    Objects.requireNonNull(address, "address");
    if (feePercent < 0) {
      throw new IllegalArgumentException("feePercent must not be negative");
    }
  }

  /**
   * Fee in basis points, rounded.
   *
   * @return the int
   */
  public int feeBasisPoints() {
    return (int) Math.round(feePercent * 100.0);
  }
}
