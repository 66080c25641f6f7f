package com.codeheadsystems.veil.client.manager;

import com.codeheadsystems.veil.client.accessor.LedgerAccessor;
import com.codeheadsystems.veil.client.config.VeilClientConfig;
import com.codeheadsystems.veil.client.store.TtlCache;
import com.codeheadsystems.veil.exceptions.InvalidRequestException;
import com.codeheadsystems.veil.ledger.AccountRecord;
import com.codeheadsystems.veil.ledger.PoolAccount;
import com.codeheadsystems.veil.ledger.PoolAccountLayout;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.TokenType;
import io.github.resilience4j.retry.Retry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of pools, read from program-owned pool accounts. Pool lists are non-critical, so a
 * failed refresh serves the last good list.
 */
@Singleton
public class PoolManager {
  private static final Logger log = LoggerFactory.getLogger(PoolManager.class);
  private static final String ALL = "all";

  private final LedgerAccessor ledgerAccessor;
  private final Retry retry;
  private final TtlCache<String, List<PoolAccount>> cache;

  /**
   * Instantiates a new Pool manager.
   *
   * @param ledgerAccessor   the ledger accessor
   * @param veilClientConfig the veil client config
   * @param clock            the clock
   */
  @Inject
  public PoolManager(final LedgerAccessor ledgerAccessor,
                     final VeilClientConfig veilClientConfig,
                     final Clock clock) {
    log.info("PoolManager({})", ledgerAccessor);
    this.ledgerAccessor = ledgerAccessor;
    this.retry = veilClientConfig.readRetry("pools");
    this.cache = new TtlCache<>("pools", veilClientConfig.poolCacheTtl(), clock);
  }

  /**
   * Every pool, active or not.
   *
   * @param forceRefresh bypass the cache
   * @return the list
   */
  public List<PoolAccount> listPools(final boolean forceRefresh) {
    log.debug("listPools(forceRefresh={})", forceRefresh);
    return cache.get(ALL, forceRefresh, () -> Retry.decorateSupplier(retry, this::fetchPools).get());
  }

  /**
   * The single active pool for a denomination and token.
   *
   * @param denomination the denomination
   * @param tokenType    the token type
   * @return the pool account
   * @throws InvalidRequestException if no active pool exists
   * @throws IllegalStateException   if more than one does
   */
  public PoolAccount getPool(final long denomination, final TokenType tokenType) {
    log.debug("getPool(denomination={}, token={})", denomination, tokenType);
    final List<PoolAccount> matches = listPools(false).stream()
        .filter(p -> p.denomination() == denomination && p.tokenType() == tokenType && p.active())
        .collect(Collectors.toList());
    if (matches.isEmpty()) {
      throw new InvalidRequestException("No active pool for " + denomination + " " + tokenType);
    }
    if (matches.size() > 1) {
      throw new IllegalStateException("Multiple active pools for " + denomination + " " + tokenType);
    }
    return matches.get(0);
  }

  /**
   * Pool by id. A miss forces one refresh before giving up.
   *
   * @param poolId the pool id
   * @return the optional
   */
  public Optional<PoolAccount> getPoolById(final Address poolId) {
    log.debug("getPoolById(poolId={})", poolId);
    final Optional<PoolAccount> cached = find(listPools(false), poolId);
    return cached.isPresent() ? cached : find(listPools(true), poolId);
  }

  /**
   * Drop cached pools.
   */
  public void clear() {
    cache.clear();
  }

  private List<PoolAccount> fetchPools() {
    final List<PoolAccount> pools = new ArrayList<>();
    for (AccountRecord account : ledgerAccessor.getProgramAccounts(PoolAccountLayout.FILTER)) {
      try {
        pools.add(PoolAccountLayout.decode(account));
      } catch (IllegalArgumentException e) {
        log.warn("fetchPools: skipping undecodable pool account {}: {}", account.address(), e.getMessage());
      }
    }
    log.trace("fetchPools() -> {}", pools.size());
    return List.copyOf(pools);
  }

  private static Optional<PoolAccount> find(final List<PoolAccount> pools, final Address poolId) {
    return pools.stream().filter(p -> p.poolId().equals(poolId)).findFirst();
  }
}
