package com.codeheadsystems.veil.model;

import com.codeheadsystems.veil.common.ByteUtils;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything needed to reconstruct a withdrawal. Held only by the user; this library never
 * stores it.
 *
 * @param poolId            the pool id
 * @param tokenType         the token type
 * @param denomination      the denomination in base units
 * @param secret            the 32-byte secret
 * @param nullifierPreimage the 32-byte nullifier preimage
 * @param timestamp         creation time, epoch millis
 * @param recipient         the bound recipient, or null for a recipient-agnostic commitment
 */
public record DepositNote(Address poolId,
                          TokenType tokenType,
                          long denomination,
                          byte[] secret,
                          byte[] nullifierPreimage,
                          long timestamp,
                          Address recipient) {

  /**
   * Instantiates a new Deposit note.
   */
  public DepositNote {
    Objects.requireNonNull(poolId, "poolId");
    Objects.requireNonNull(tokenType, "tokenType");
    if (denomination <= 0) {
      throw new IllegalArgumentException("denomination must be positive");
    }
    secret = ByteUtils.requireLength(secret, ByteUtils.FIELD_LENGTH, "secret").clone();
    nullifierPreimage = ByteUtils.requireLength(nullifierPreimage, ByteUtils.FIELD_LENGTH,
        "nullifierPreimage").clone();
  }

  @Override
  public byte[] secret() {
    return secret.clone();
  }

  @Override
  public byte[] nullifierPreimage() {
    return nullifierPreimage.clone();
  }

  /**
   * The recipient, if the commitment binds one.
   *
   * @return the optional
   */
  public Optional<Address> boundRecipient() {
    return Optional.ofNullable(recipient);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DepositNote other)) {
      return false;
    }
    return denomination == other.denomination
        && timestamp == other.timestamp
        && poolId.equals(other.poolId)
        && tokenType == other.tokenType
        && Arrays.equals(secret, other.secret)
        && Arrays.equals(nullifierPreimage, other.nullifierPreimage)
        && Objects.equals(recipient, other.recipient);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(poolId, tokenType, denomination, timestamp, recipient);
    result = 31 * result + Arrays.hashCode(secret);
    return 31 * result + Arrays.hashCode(nullifierPreimage);
  }

  @Override
  public String toString() {
    return "DepositNote{pool=" + poolId + ", token=" + tokenType + ", denomination=" + denomination
        + ", timestamp=" + timestamp + ", recipient=" + recipient + ", secret=<redacted>}";
  }
}
