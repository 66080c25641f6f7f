package com.codeheadsystems.veil.ledger;

import static com.codeheadsystems.veil.common.ByteUtils.FIELD_LENGTH;

import com.codeheadsystems.veil.common.ByteUtils;
import com.codeheadsystems.veil.model.Address;
import java.util.Arrays;
import java.util.Objects;
import org.bouncycastle.util.encoders.Hex;

/**
 * Transfer {@code amount} into the pool and insert {@code commitment} into {@code treeId}, as one
 * atomic ledger operation.
 * <pre>
 * 0x01 | amount u64 LE | commitment[32] | treeId[32] | poolId[32]
 * </pre>
 *
 * @param amount     the amount in base units
 * @param commitment the commitment
 * @param treeId     the tree id
 * @param poolId     the pool id
 */
public record DepositOperation(long amount, byte[] commitment, Address treeId, Address poolId)
    implements LedgerOperation {

  /**
   * The opcode.
   */
  public static final byte OPCODE = 0x01;
  /**
   * Serialized size.
   */
  public static final int SIZE = 1 + 8 + FIELD_LENGTH * 3;

  /**
   * Instantiates a new Deposit operation.
   */
  public DepositOperation {
    if (amount <= 0) {
      throw new IllegalArgumentException("amount must be positive");
    }
    commitment = ByteUtils.requireLength(commitment, FIELD_LENGTH, "commitment").clone();
    Objects.requireNonNull(treeId, "treeId");
    Objects.requireNonNull(poolId, "poolId");
  }

  /**
   * Deserialize deposit operation.
   *
   * @param bytes the bytes
   * @return the deposit operation
   */
  public static DepositOperation deserialize(final byte[] bytes) {
    if (bytes.length != SIZE || bytes[0] != OPCODE) {
      throw new IllegalArgumentException("Not a deposit operation");
    }
    int offset = 1;
    final long amount = ByteUtils.readU64(bytes, offset);
    offset += 8;
    final byte[] commitment = ByteUtils.slice(bytes, offset, FIELD_LENGTH);
    offset += FIELD_LENGTH;
    final Address treeId = new Address(ByteUtils.slice(bytes, offset, FIELD_LENGTH));
    offset += FIELD_LENGTH;
    final Address poolId = new Address(ByteUtils.slice(bytes, offset, FIELD_LENGTH));
    return new DepositOperation(amount, commitment, treeId, poolId);
  }

  @Override
  public byte opcode() {
    return OPCODE;
  }

  @Override
  public byte[] serialize() {
    final byte[] out = new byte[SIZE];
    out[0] = OPCODE;
    ByteUtils.writeU64(out, 1, amount);
    System.arraycopy(commitment, 0, out, 9, FIELD_LENGTH);
    System.arraycopy(treeId.bytes(), 0, out, 9 + FIELD_LENGTH, FIELD_LENGTH);
    System.arraycopy(poolId.bytes(), 0, out, 9 + FIELD_LENGTH * 2, FIELD_LENGTH);
    return out;
  }

  @Override
  public byte[] commitment() {
    return commitment.clone();
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof DepositOperation other
        && amount == other.amount
        && Arrays.equals(commitment, other.commitment)
        && treeId.equals(other.treeId)
        && poolId.equals(other.poolId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(amount, Arrays.hashCode(commitment), treeId, poolId);
  }

  @Override
  public String toString() {
    return "DepositOperation{amount=" + amount + ", commitment=" + Hex.toHexString(commitment)
        + ", treeId=" + treeId + ", poolId=" + poolId + "}";
  }
}
