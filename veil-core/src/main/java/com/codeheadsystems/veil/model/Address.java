package com.codeheadsystems.veil.model;

import com.codeheadsystems.veil.common.ByteUtils;
import java.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

/**
 * A 32-byte ledger address or account id. Pool ids, tree ids, relayer and recipient keys are all
 * addresses.
 *
 * @param bytes the raw bytes
 */
public record Address(byte[] bytes) implements Comparable<Address> {

  /**
   * The all-zero address.
   */
  public static final Address ZERO = new Address(new byte[ByteUtils.FIELD_LENGTH]);

  /**
   * Instantiates a new Address.
   *
   * @param bytes the bytes
   */
  public Address {
    bytes = ByteUtils.requireLength(bytes, ByteUtils.FIELD_LENGTH, "address").clone();
  }

  /**
   * Parses a 64-character hex address.
   *
   * @param hex the hex
   * @return the address
   */
  public static Address fromHex(final String hex) {
    if (hex == null || hex.length() != ByteUtils.FIELD_LENGTH * 2) {
      throw new IllegalArgumentException("Address must be 64 hex characters");
    }
    try {
      return new Address(Hex.decode(hex));
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Address is not valid hex: " + hex, e);
    }
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  /**
   * Lowercase hex form.
   *
   * @return the string
   */
  public String toHex() {
    return Hex.toHexString(bytes);
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof Address other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public int compareTo(final Address o) {
    return ByteUtils.compareUnsigned(bytes, o.bytes);
  }

  @Override
  public String toString() {
    return toHex();
  }
}
