package com.codeheadsystems.veil.relayer;

/**
 * Optional bounds applied before sorting. A null bound is not applied. A relayer whose metric is
 * unknown fails any bound on that metric.
 *
 * @param maxFeePercent     the max fee percent
 * @param minSuccessRate    the min success rate percent
 * @param maxResponseTimeMs the max response time ms
 */
public record RelayerFilter(Double maxFeePercent, Double minSuccessRate, Integer maxResponseTimeMs) {

  /**
   * No bounds; only inactive relayers are excluded.
   */
  public static final RelayerFilter NONE = new RelayerFilter(null, null, null);

  /**
   * Whether the relayer is active and within every bound.
   *
   * @param relayer the relayer
   * @return the boolean
   */
  public boolean matches(final Relayer relayer) {
    if (!relayer.active()) {
      return false;
    }
    if (maxFeePercent != null && relayer.feePercent() > maxFeePercent) {
      return false;
    }
    if (minSuccessRate != null
        && (relayer.successRatePercent() == null || relayer.successRatePercent() < minSuccessRate)) {
      return false;
    }
    return maxResponseTimeMs == null
        || (relayer.responseTimeMs() != null && relayer.responseTimeMs() <= maxResponseTimeMs);
  }
}
