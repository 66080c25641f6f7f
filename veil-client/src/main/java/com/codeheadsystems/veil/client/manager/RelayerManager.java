package com.codeheadsystems.veil.client.manager;

import com.codeheadsystems.veil.client.accessor.LedgerAccessor;
import com.codeheadsystems.veil.client.config.VeilClientConfig;
import com.codeheadsystems.veil.client.store.TtlCache;
import com.codeheadsystems.veil.exceptions.RelayerUnavailableException;
import com.codeheadsystems.veil.ledger.AccountRecord;
import com.codeheadsystems.veil.ledger.RelayerAccountLayout;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.relayer.Relayer;
import com.codeheadsystems.veil.relayer.RelayerFilter;
import com.codeheadsystems.veil.relayer.RelayerSelector;
import io.github.resilience4j.retry.Retry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relayer registry backed by program-owned relayer accounts.
 * <p>
 * Relayers are a convenience path. A failed refresh serves the last good list instead of failing
 * the caller, and only {@link #getBestRelayer(RelayerFilter)} raises when nothing qualifies.
 */
@Singleton
public class RelayerManager {
  private static final Logger log = LoggerFactory.getLogger(RelayerManager.class);
  private static final String ALL = "all";

  private final LedgerAccessor ledgerAccessor;
  private final Retry retry;
  private final RelayerSelector selector;
  private final ExecutorService pingExecutor;
  private final Duration pingTimeout;
  private final TtlCache<String, List<Relayer>> listCache;
  private final TtlCache<Address, Optional<Relayer>> addressCache;

  /**
   * Instantiates a new Relayer manager.
   *
   * @param ledgerAccessor   the ledger accessor
   * @param veilClientConfig the veil client config
   * @param pingExecutor     runs relayer pings
   * @param clock            the clock
   */
  @Inject
  public RelayerManager(final LedgerAccessor ledgerAccessor,
                        final VeilClientConfig veilClientConfig,
                        final ExecutorService pingExecutor,
                        final Clock clock) {
    log.info("RelayerManager({}, {})", ledgerAccessor, veilClientConfig.relayerScoring());
    this.ledgerAccessor = ledgerAccessor;
    this.retry = veilClientConfig.readRetry("relayers");
    this.selector = new RelayerSelector(veilClientConfig.relayerScoring());
    this.pingExecutor = pingExecutor;
    this.pingTimeout = veilClientConfig.relayerPingTimeout();
    this.listCache = new TtlCache<>("relayers", veilClientConfig.relayerCacheTtl(), clock);
    this.addressCache = new TtlCache<>("relayer", veilClientConfig.relayerCacheTtl(), clock);
  }

  /**
   * Every registered relayer, active or not.
   *
   * @param forceRefresh bypass the cache
   * @return the list
   */
  public List<Relayer> refresh(final boolean forceRefresh) {
    log.debug("refresh(forceRefresh={})", forceRefresh);
    return listCache.get(ALL, forceRefresh, () -> Retry.decorateSupplier(retry, this::fetchRelayers).get());
  }

  /**
   * Active relayers, in registry order.
   *
   * @return the list
   */
  public List<Relayer> getActiveRelayers() {
    return refresh(false).stream().filter(Relayer::active).collect(Collectors.toList());
  }

  /**
   * One relayer by address.
   *
   * @param address      the address
   * @param forceRefresh bypass the cache
   * @return the optional
   */
  public Optional<Relayer> getRelayer(final Address address, final boolean forceRefresh) {
    log.debug("getRelayer(address={}, forceRefresh={})", address, forceRefresh);
    return addressCache.get(address, forceRefresh, () -> Retry.decorateSupplier(retry,
        () -> ledgerAccessor.getAccount(address)
            .filter(account -> RelayerAccountLayout.FILTER.matches(account.data()))
            .map(RelayerAccountLayout::decode)).get());
  }

  /**
   * Highest scoring active relayer that passes the filter.
   *
   * @param filter the filter
   * @return the relayer
   * @throws RelayerUnavailableException if none qualifies
   */
  public Relayer getBestRelayer(final RelayerFilter filter) {
    final List<Relayer> candidates = getActiveRelayers().stream()
        .filter(filter::matches)
        .collect(Collectors.toList());
    final Relayer best = selector.best(candidates)
        .orElseThrow(() -> new RelayerUnavailableException(
            "No active relayer matches " + filter + " among " + candidates.size() + " candidates", null));
    log.debug("getBestRelayer({}) -> {} (score {})", filter, best.address(), selector.score(best));
    return best;
  }

  /**
   * Score under the configured coefficients.
   *
   * @param relayer the relayer
   * @return the double
   */
  public double score(final Relayer relayer) {
    return selector.score(relayer);
  }

  public List<Relayer> getLowestFeeRelayers(final RelayerFilter filter, final int limit) {
    return selector.lowestFee(refresh(false), filter, limit);
  }

  public List<Relayer> getMostReliableRelayers(final RelayerFilter filter, final int limit) {
    return selector.mostReliable(refresh(false), filter, limit);
  }

  public List<Relayer> getFastestRelayers(final RelayerFilter filter, final int limit) {
    return selector.fastest(refresh(false), filter, limit);
  }

  public List<Relayer> getHighestVolumeRelayers(final RelayerFilter filter, final int limit) {
    return selector.highestVolume(refresh(false), filter, limit);
  }

  /**
   * Round trip time of a forced account read for the relayer.
   *
   * @param address the address
   * @return milliseconds, or empty on timeout, failure, or an unknown or inactive relayer
   */
  public OptionalInt pingRelayer(final Address address) {
    final long start = System.nanoTime();
    final Future<Optional<Relayer>> lookup;
    try {
      lookup = pingExecutor.submit(() -> getRelayer(address, true));
    } catch (RejectedExecutionException e) {
      log.warn("pingRelayer({}) executor unavailable: {}", address, e.getMessage());
      return OptionalInt.empty();
    }
    try {
      final Optional<Relayer> relayer = lookup.get(pingTimeout.toMillis(), TimeUnit.MILLISECONDS);
      final int elapsedMs = (int) Math.min(Integer.MAX_VALUE,
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
      if (relayer.isEmpty() || !relayer.get().active()) {
        log.debug("pingRelayer({}) unknown or inactive", address);
        return OptionalInt.empty();
      }
      log.debug("pingRelayer({}) -> {}ms", address, elapsedMs);
      return OptionalInt.of(elapsedMs);
    } catch (TimeoutException e) {
      lookup.cancel(true);
      log.debug("pingRelayer({}) timed out after {}", address, pingTimeout);
      return OptionalInt.empty();
    } catch (ExecutionException e) {
      log.debug("pingRelayer({}) failed: {}", address, e.getCause().getMessage());
      return OptionalInt.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("pingRelayer({}) interrupted", address);
      return OptionalInt.empty();
    }
  }

  /**
   * Drop cached relayers.
   */
  public void clear() {
    listCache.clear();
    addressCache.clear();
  }

  private List<Relayer> fetchRelayers() {
    final List<Relayer> relayers = new ArrayList<>();
    for (AccountRecord account : ledgerAccessor.getProgramAccounts(RelayerAccountLayout.FILTER)) {
      try {
        relayers.add(RelayerAccountLayout.decode(account));
      } catch (IllegalArgumentException e) {
        log.warn("fetchRelayers: skipping undecodable relayer account {}: {}", account.address(), e.getMessage());
      }
    }
    log.trace("fetchRelayers() -> {}", relayers.size());
    return List.copyOf(relayers);
  }
}
