package com.codeheadsystems.veil.client.manager;

import com.codeheadsystems.veil.client.accessor.LedgerAccessor;
import com.codeheadsystems.veil.client.config.VeilClientConfig;
import io.github.resilience4j.retry.Retry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only view of the ledger's nullifier set.
 * <p>
 * A local "unspent" answer is advisory. The ledger records nullifiers atomically and may still
 * refuse a spend that passed this check; the withdraw flow handles that case.
 */
@Singleton
public class NullifierManager {
  private static final Logger log = LoggerFactory.getLogger(NullifierManager.class);

  private final LedgerAccessor ledgerAccessor;
  private final Retry retry;

  /**
   * Instantiates a new Nullifier manager.
   *
   * @param ledgerAccessor   the ledger accessor
   * @param veilClientConfig the veil client config
   */
  @Inject
  public NullifierManager(final LedgerAccessor ledgerAccessor, final VeilClientConfig veilClientConfig) {
    log.info("NullifierManager({})", ledgerAccessor);
    this.ledgerAccessor = ledgerAccessor;
    this.retry = veilClientConfig.readRetry("nullifier");
  }

  /**
   * Whether the nullifier hash is recorded. Never answered from a cache.
   *
   * @param nullifierHash the nullifier hash
   * @return the boolean
   */
  public boolean checkNullifier(final byte[] nullifierHash) {
    final boolean spent = Retry.decorateSupplier(retry, () -> ledgerAccessor.isNullifierSpent(nullifierHash)).get();
    log.debug("checkNullifier(nullifierHash={}) -> {}", Hex.toHexString(nullifierHash), spent);
    return spent;
  }

  /**
   * Bulk check for display purposes. Each hash is read independently, so the answers are not a
   * consistent snapshot.
   *
   * @param nullifierHashes the nullifier hashes
   * @return hex hash to spent flag, in input order
   */
  public Map<String, Boolean> batchCheckNullifiers(final List<byte[]> nullifierHashes) {
    log.debug("batchCheckNullifiers(count={})", nullifierHashes.size());
    final Map<String, Boolean> out = new LinkedHashMap<>();
    for (byte[] hash : nullifierHashes) {
      out.put(Hex.toHexString(hash), checkNullifier(hash));
    }
    return out;
  }
}
