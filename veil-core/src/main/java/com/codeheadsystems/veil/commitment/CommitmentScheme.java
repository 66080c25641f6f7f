package com.codeheadsystems.veil.commitment;

import com.codeheadsystems.veil.common.ByteUtils;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.DepositNote;

/**
 * Derives the values a note commits to.
 * <ul>
 *   <li>commitment = H(secret || nullifierPreimage || recipient), recipient zero-filled when the
 *   note is not bound to one</li>
 *   <li>nullifierHash = H(nullifierPreimage || poolId); the pool id is the domain tag</li>
 *   <li>Merkle node = H(left || right)</li>
 * </ul>
 *
 * @param hashSuite the hash suite
 */
public record CommitmentScheme(HashSuite hashSuite) {

  /**
   * Default scheme over SHA-256.
   */
  public static final CommitmentScheme DEFAULT = new CommitmentScheme(HashSuite.SHA256);

  /**
   * Commitment for raw components.
   *
   * @param secret            the secret
   * @param nullifierPreimage the nullifier preimage
   * @param recipient         the recipient or null
   * @return the 32-byte commitment
   */
  public byte[] commitment(final byte[] secret, final byte[] nullifierPreimage, final Address recipient) {
    ByteUtils.requireLength(secret, ByteUtils.FIELD_LENGTH, "secret");
    ByteUtils.requireLength(nullifierPreimage, ByteUtils.FIELD_LENGTH, "nullifierPreimage");
    final byte[] recipientBytes = recipient == null ? Address.ZERO.bytes() : recipient.bytes();
    return hashSuite.hash(secret, nullifierPreimage, recipientBytes);
  }

  /**
   * Commitment for a note.
   *
   * @param note the note
   * @return the byte [ ]
   */
  public byte[] commitment(final DepositNote note) {
    return commitment(note.secret(), note.nullifierPreimage(), note.recipient());
  }

  /**
   * Nullifier hash, domain-separated by pool.
   *
   * @param nullifierPreimage the nullifier preimage
   * @param domainTag         the domain tag (pool id)
   * @return the 32-byte hash
   */
  public byte[] nullifierHash(final byte[] nullifierPreimage, final Address domainTag) {
    ByteUtils.requireLength(nullifierPreimage, ByteUtils.FIELD_LENGTH, "nullifierPreimage");
    return hashSuite.hash(nullifierPreimage, domainTag.bytes());
  }

  /**
   * Nullifier hash for a note.
   *
   * @param note the note
   * @return the byte [ ]
   */
  public byte[] nullifierHash(final DepositNote note) {
    return nullifierHash(note.nullifierPreimage(), note.poolId());
  }

  /**
   * Parent of two Merkle nodes.
   *
   * @param left  the left
   * @param right the right
   * @return the byte [ ]
   */
  public byte[] hashPair(final byte[] left, final byte[] right) {
    return hashSuite.hash(left, right);
  }
}
