package com.codeheadsystems.veil.commitment;

import java.util.function.Supplier;
import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.KeccakDigest;
import org.bouncycastle.crypto.digests.SHA256Digest;

/**
 * Hash functions usable for commitments, nullifier hashes and Merkle nodes. Every suite produces
 * 32-byte output.
 * <p>
 * The circuit fixes which suite a deployment uses; the client must match it.
 */
public enum HashSuite {

  /**
   * SHA-256.
   */
  SHA256(SHA256Digest::new),
  /**
   * Keccak-256 (pre-standard padding, as used by EVM tooling).
   */
  KECCAK256(() -> new KeccakDigest(256));

  private final Supplier<Digest> digestFactory;

  HashSuite(final Supplier<Digest> digestFactory) {
    this.digestFactory = digestFactory;
  }

  /**
   * Returns the suite for the given name. Accepted names: {@code "SHA256"}, {@code "KECCAK256"}.
   *
   * @param name the name
   * @return the hash suite
   */
  public static HashSuite fromName(final String name) {
    return switch (name) {
      case "SHA256" -> SHA256;
      case "KECCAK256" -> KECCAK256;
      default -> throw new IllegalArgumentException("Unknown hash suite: " + name
          + ". Valid values: SHA256, KECCAK256");
    };
  }

  /**
   * Hashes the concatenation of the given parts. Digests are not thread safe, so each call gets
   * its own.
   *
   * @param parts the parts
   * @return the 32-byte digest
   */
  public byte[] hash(final byte[]... parts) {
    final Digest digest = digestFactory.get();
    for (byte[] part : parts) {
      digest.update(part, 0, part.length);
    }
    final byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }
}
