package com.codeheadsystems.veil.circuit;

import com.codeheadsystems.veil.common.ByteUtils;
import com.codeheadsystems.veil.model.Address;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Public outputs of the withdrawal circuit, in the order the verifier expects them.
 *
 * @param root          the root
 * @param nullifierHash the nullifier hash
 * @param recipient     the recipient
 * @param relayer       the relayer (the recipient itself when self-paid)
 * @param fee           the fee in base units
 */
public record PublicSignals(byte[] root, byte[] nullifierHash, Address recipient, Address relayer, long fee) {

  /**
   * Number of public signals.
   */
  public static final int COUNT = 5;

  /**
   * Instantiates a new Public signals.
   */
  public PublicSignals {
    root = ByteUtils.requireLength(root, ByteUtils.FIELD_LENGTH, "root").clone();
    nullifierHash = ByteUtils.requireLength(nullifierHash, ByteUtils.FIELD_LENGTH, "nullifierHash").clone();
    Objects.requireNonNull(recipient, "recipient");
    Objects.requireNonNull(relayer, "relayer");
  }

  /**
   * Parses the prover's ordered decimal signal strings.
   *
   * @param signals the signals
   * @return the public signals
   */
  public static PublicSignals fromSignalStrings(final List<String> signals) {
    if (signals == null || signals.size() != COUNT) {
      throw new IllegalArgumentException("Expected " + COUNT + " public signals");
    }
    return new PublicSignals(
        fromDecimal(signals.get(0)),
        fromDecimal(signals.get(1)),
        new Address(fromDecimal(signals.get(2))),
        new Address(fromDecimal(signals.get(3))),
        Long.parseLong(signals.get(4)));
  }

  /**
   * Ordered decimal strings: root, nullifierHash, recipient, relayer, fee.
   *
   * @return the list
   */
  public List<String> toSignalStrings() {
    return List.of(
        new BigInteger(1, root).toString(),
        new BigInteger(1, nullifierHash).toString(),
        new BigInteger(1, recipient.bytes()).toString(),
        new BigInteger(1, relayer.bytes()).toString(),
        Long.toString(fee));
  }

  @Override
  public byte[] root() {
    return root.clone();
  }

  @Override
  public byte[] nullifierHash() {
    return nullifierHash.clone();
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof PublicSignals other
        && fee == other.fee
        && Arrays.equals(root, other.root)
        && Arrays.equals(nullifierHash, other.nullifierHash)
        && recipient.equals(other.recipient)
        && relayer.equals(other.relayer);
  }

  @Override
  public int hashCode() {
    return Objects.hash(Arrays.hashCode(root), Arrays.hashCode(nullifierHash), recipient, relayer, fee);
  }

  private static byte[] fromDecimal(final String value) {
    final BigInteger n = new BigInteger(value);
    if (n.signum() < 0 || n.bitLength() > ByteUtils.FIELD_LENGTH * 8) {
      throw new IllegalArgumentException("Signal out of range");
    }
    final byte[] raw = n.toByteArray();
    final byte[] out = new byte[ByteUtils.FIELD_LENGTH];
    final int copy = Math.min(raw.length, ByteUtils.FIELD_LENGTH);
    System.arraycopy(raw, raw.length - copy, out, ByteUtils.FIELD_LENGTH - copy, copy);
    return out;
  }
}
