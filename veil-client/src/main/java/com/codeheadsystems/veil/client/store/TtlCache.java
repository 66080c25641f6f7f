package com.codeheadsystems.veil.client.store;

import com.codeheadsystems.veil.exceptions.VeilException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Time-boxed cache for non-critical reads (relayer and pool lists).
 * <p>
 * A fresh entry is served without calling the loader. When the loader fails with a retryable
 * {@link VeilException} and an older value exists, the older value is served and a warning is
 * logged. Never use this for nullifier or proof checks.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class TtlCache<K, V> {
  private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

  private final String name;
  private final Duration ttl;
  private final Clock clock;
  private final Map<K, Entry<V>> entries = new ConcurrentHashMap<>();

  /**
   * Instantiates a new Ttl cache.
   *
   * @param name  the name, used in logs
   * @param ttl   the ttl
   * @param clock the clock
   */
  public TtlCache(final String name, final Duration ttl, final Clock clock) {
    log.info("TtlCache({}, ttl={})", name, ttl);
    this.name = name;
    this.ttl = ttl;
    this.clock = clock;
  }

  /**
   * Returns a fresh value, loading it when missing, expired or forced.
   *
   * @param key          the key
   * @param forceRefresh skip the freshness check
   * @param loader       the loader
   * @return the value
   */
  public V get(final K key, final boolean forceRefresh, final Supplier<V> loader) {
    final Entry<V> existing = entries.get(key);
    final Instant now = clock.instant();
    if (!forceRefresh && existing != null && existing.loadedAt().plus(ttl).isAfter(now)) {
      log.trace("get({}:{}) fresh", name, key);
      return existing.value();
    }
    try {
      final V value = loader.get();
      entries.put(key, new Entry<>(value, now));
      return value;
    } catch (VeilException e) {
      if (existing != null && e.isRetryable()) {
        log.warn("get({}:{}) load failed, serving value from {}: {}", name, key, existing.loadedAt(),
            e.getMessage());
        return existing.value();
      }
      throw e;
    }
  }

  /**
   * The cached value regardless of age.
   *
   * @param key the key
   * @return the optional
   */
  public Optional<V> peek(final K key) {
    return Optional.ofNullable(entries.get(key)).map(Entry::value);
  }

  /**
   * Drop one entry.
   *
   * @param key the key
   */
  public void invalidate(final K key) {
    entries.remove(key);
  }

  /**
   * Drop everything.
   */
  public void clear() {
    entries.clear();
  }

  private record Entry<V>(V value, Instant loadedAt) {
  }
}
