package com.codeheadsystems.veil.relayer;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ranks relayers. All sorts are stable, so equal relayers keep the order the ledger listed them
 * in.
 */
public class RelayerSelector {

  private final RelayerScoring scoring;

  /**
   * Instantiates a new Relayer selector.
   *
   * @param scoring the scoring
   */
  public RelayerSelector(final RelayerScoring scoring) {
    this.scoring = scoring;
  }

  /**
   * Highest scoring active relayer. Ties go to the first one seen.
   *
   * @param relayers the relayers
   * @return the optional
   */
  public Optional<Relayer> best(final List<Relayer> relayers) {
    Relayer best = null;
    double bestScore = Double.NEGATIVE_INFINITY;
    for (Relayer relayer : relayers) {
      if (!relayer.active()) {
        continue;
      }
      final double score = scoring.score(relayer);
      if (best == null || score > bestScore) {
        best = relayer;
        bestScore = score;
      }
    }
    return Optional.ofNullable(best);
  }

  /**
   * Score for one relayer.
   *
   * @param relayer the relayer
   * @return the double
   */
  public double score(final Relayer relayer) {
    return scoring.score(relayer);
  }

  /**
   * Cheapest first.
   *
   * @param relayers the relayers
   * @param filter   the filter
   * @param limit    the limit
   * @return the list
   */
  public List<Relayer> lowestFee(final List<Relayer> relayers, final RelayerFilter filter, final int limit) {
    return sorted(relayers, filter, limit, Comparator.comparingDouble(Relayer::feePercent));
  }

  /**
   * Highest success rate first; unknown rates sort as zero.
   *
   * @param relayers the relayers
   * @param filter   the filter
   * @param limit    the limit
   * @return the list
   */
  public List<Relayer> mostReliable(final List<Relayer> relayers, final RelayerFilter filter, final int limit) {
    return sorted(relayers, filter, limit,
        Comparator.comparingDouble((Relayer r) -> r.successRatePercent() == null ? 0.0 : r.successRatePercent())
            .reversed());
  }

  /**
   * Fastest first; unknown response times sort last.
   *
   * @param relayers the relayers
   * @param filter   the filter
   * @param limit    the limit
   * @return the list
   */
  public List<Relayer> fastest(final List<Relayer> relayers, final RelayerFilter filter, final int limit) {
    return sorted(relayers, filter, limit,
        Comparator.comparingInt((Relayer r) -> r.responseTimeMs() == null ? Integer.MAX_VALUE : r.responseTimeMs()));
  }

  /**
   * Largest cumulative volume first.
   *
   * @param relayers the relayers
   * @param filter   the filter
   * @param limit    the limit
   * @return the list
   */
  public List<Relayer> highestVolume(final List<Relayer> relayers, final RelayerFilter filter, final int limit) {
    return sorted(relayers, filter, limit, Comparator.comparingDouble(Relayer::totalVolume).reversed());
  }

  private static List<Relayer> sorted(final List<Relayer> relayers,
                                      final RelayerFilter filter,
                                      final int limit,
                                      final Comparator<Relayer> order) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must not be negative");
    }
    return relayers.stream()
        .filter(filter::matches)
        .sorted(order)
        .limit(limit)
        .collect(Collectors.toList());
  }
}
