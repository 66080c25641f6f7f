package com.codeheadsystems.veil.relayer;

/**
 * Coefficients of the relayer score:
 * <pre>
 * base - feeWeight * feePercent
 *      + (successRate, or defaultSuccessRate when unknown)
 *      - min(maxResponsePenalty, floor(responseTimeMs / responseTimeDivisor)), or unknownResponsePenalty
 *      + min(maxVolumeBonus, floor(totalVolume))
 * </pre>
 * The defaults for unknown metrics are pessimistic but never disqualifying.
 *
 * @param base                   the base
 * @param feeWeight              the fee weight
 * @param defaultSuccessRate     the default success rate
 * @param responseTimeDivisor    the response time divisor
 * @param maxResponsePenalty     the max response penalty
 * @param unknownResponsePenalty the unknown response penalty
 * @param maxVolumeBonus         the max volume bonus
 */
public record RelayerScoring(double base,
                             double feeWeight,
                             double defaultSuccessRate,
                             double responseTimeDivisor,
                             double maxResponsePenalty,
                             double unknownResponsePenalty,
                             double maxVolumeBonus) {

  /**
   * The default coefficients.
   */
  public static final RelayerScoring DEFAULT = new RelayerScoring(100, 10, 90, 20, 50, 25, 10);

  /**
   * Instantiates a new Relayer scoring.
   */
  public RelayerScoring {
    if (responseTimeDivisor <= 0) {
      throw new IllegalArgumentException("responseTimeDivisor must be positive");
    }
  }

  /**
   * Score a relayer. Higher is better.
   *
   * @param relayer the relayer
   * @return the double
   */
  public double score(final Relayer relayer) {
    final double success = relayer.successRatePercent() == null
        ? defaultSuccessRate
        : relayer.successRatePercent();
    final double responsePenalty = relayer.responseTimeMs() == null
        ? unknownResponsePenalty
        : Math.min(maxResponsePenalty, Math.floor(relayer.responseTimeMs() / responseTimeDivisor));
    final double volumeBonus = Math.min(maxVolumeBonus, Math.floor(relayer.totalVolume()));
    return base - feeWeight * relayer.feePercent() + success - responsePenalty + volumeBonus;
  }
}
