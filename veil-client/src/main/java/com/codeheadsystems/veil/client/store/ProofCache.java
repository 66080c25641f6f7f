package com.codeheadsystems.veil.client.store;

import com.codeheadsystems.veil.circuit.CircuitInputs;
import com.codeheadsystems.veil.circuit.WithdrawalProof;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finished proofs keyed by a SHA-256 fingerprint of the canonical circuit input encoding.
 * <p>
 * Every entry is tagged with the root it was proven against. A lookup only hits when the root
 * still matches, and {@link #invalidateRoot(byte[])} drops all entries for a root the ledger has
 * moved past. Least recently used entries are evicted beyond the capacity.
 */
public class ProofCache {
  private static final Logger log = LoggerFactory.getLogger(ProofCache.class);

  private final int capacity;
  private final Map<String, Entry> entries;

  /**
   * Instantiates a new Proof cache.
   *
   * @param capacity the capacity
   */
  public ProofCache(final int capacity) {
    log.info("ProofCache(capacity={})", capacity);
    this.capacity = capacity;
    this.entries = new LinkedHashMap<>(16, 0.75f, true);
  }

  /**
   * Fingerprint of a circuit input vector.
   *
   * @param inputs the inputs
   * @return the hex fingerprint
   */
  public static String fingerprint(final CircuitInputs inputs) {
    final byte[] encoded = inputs.canonicalEncoding();
    final SHA256Digest digest = new SHA256Digest();
    digest.update(encoded, 0, encoded.length);
    final byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return Hex.toHexString(out);
  }

  /**
   * Lookup.
   *
   * @param fingerprint the fingerprint
   * @param root        the root the caller is proving against
   * @return the optional
   */
  public synchronized Optional<WithdrawalProof> get(final String fingerprint, final byte[] root) {
    final Entry entry = entries.get(fingerprint);
    if (entry == null || !Arrays.equals(entry.root(), root)) {
      return Optional.empty();
    }
    return Optional.of(entry.proof());
  }

  /**
   * Store.
   *
   * @param fingerprint the fingerprint
   * @param proof       the proof
   */
  public synchronized void put(final String fingerprint, final WithdrawalProof proof) {
    entries.put(fingerprint, new Entry(proof.signals().root(), proof));
    while (entries.size() > capacity) {
      final Iterator<String> eldest = entries.keySet().iterator();
      eldest.next();
      eldest.remove();
    }
  }

  /**
   * Drops every entry proven against the given root.
   *
   * @param root the root
   * @return the number of entries dropped
   */
  public synchronized int invalidateRoot(final byte[] root) {
    int removed = 0;
    final Iterator<Entry> it = entries.values().iterator();
    while (it.hasNext()) {
      if (Arrays.equals(it.next().root(), root)) {
        it.remove();
        removed++;
      }
    }
    log.debug("invalidateRoot(root={}) removed={}", Hex.toHexString(root), removed);
    return removed;
  }

  public synchronized int size() {
    return entries.size();
  }

  /**
   * Drop everything.
   */
  public synchronized void clear() {
    entries.clear();
  }

  private record Entry(byte[] root, WithdrawalProof proof) {
  }
}
