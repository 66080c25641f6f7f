package com.codeheadsystems.veil.ledger;

import static com.codeheadsystems.veil.common.ByteUtils.FIELD_LENGTH;

import com.codeheadsystems.veil.circuit.WithdrawalProof;
import com.codeheadsystems.veil.common.ByteUtils;
import com.codeheadsystems.veil.model.Address;
import java.util.Arrays;
import java.util.Objects;
import org.bouncycastle.util.encoders.Hex;

/**
 * Spend a note: record the nullifier, pay {@code denomination - fee} to the recipient and
 * {@code fee} to the relayer.
 * <pre>
 * 0x02 | poolId[32] | root[32] | nullifierHash[32] | recipient[32] | relayer[32]
 *      | fee u64 LE | refund u64 LE | proofLength u32 LE | proof[proofLength]
 * </pre>
 *
 * @param poolId        the pool id
 * @param root          the root the proof was built against
 * @param nullifierHash the nullifier hash
 * @param recipient     the recipient
 * @param relayer       the relayer (the recipient when self-paid)
 * @param fee           the fee
 * @param refund        the refund, always zero for native pools
 * @param proof         the proof bytes
 */
public record WithdrawOperation(Address poolId,
                                byte[] root,
                                byte[] nullifierHash,
                                Address recipient,
                                Address relayer,
                                long fee,
                                long refund,
                                byte[] proof) implements LedgerOperation {

  /**
   * The opcode.
   */
  public static final byte OPCODE = 0x02;
  private static final int HEADER_SIZE = 1 + FIELD_LENGTH * 5 + 8 + 8 + 4;

  /**
   * Instantiates a new Withdraw operation.
   */
  public WithdrawOperation {
    Objects.requireNonNull(poolId, "poolId");
    root = ByteUtils.requireLength(root, FIELD_LENGTH, "root").clone();
    nullifierHash = ByteUtils.requireLength(nullifierHash, FIELD_LENGTH, "nullifierHash").clone();
    Objects.requireNonNull(recipient, "recipient");
    Objects.requireNonNull(relayer, "relayer");
    Objects.requireNonNull(proof, "proof");
    if (fee < 0 || refund < 0) {
      throw new IllegalArgumentException("fee and refund must not be negative");
    }
    proof = proof.clone();
  }

  /**
   * Builds the operation from a generated proof.
   *
   * @param poolId the pool id
   * @param proof  the proof
   * @return the withdraw operation
   */
  public static WithdrawOperation fromProof(final Address poolId, final WithdrawalProof proof) {
    return new WithdrawOperation(poolId,
        proof.signals().root(),
        proof.signals().nullifierHash(),
        proof.signals().recipient(),
        proof.signals().relayer(),
        proof.signals().fee(),
        0L,
        proof.proof());
  }

  /**
   * Deserialize withdraw operation.
   *
   * @param bytes the bytes
   * @return the withdraw operation
   */
  public static WithdrawOperation deserialize(final byte[] bytes) {
    if (bytes.length < HEADER_SIZE || bytes[0] != OPCODE) {
      throw new IllegalArgumentException("Not a withdraw operation");
    }
    int offset = 1;
    final Address poolId = new Address(ByteUtils.slice(bytes, offset, FIELD_LENGTH));
    offset += FIELD_LENGTH;
    final byte[] root = ByteUtils.slice(bytes, offset, FIELD_LENGTH);
    offset += FIELD_LENGTH;
    final byte[] nullifierHash = ByteUtils.slice(bytes, offset, FIELD_LENGTH);
    offset += FIELD_LENGTH;
    final Address recipient = new Address(ByteUtils.slice(bytes, offset, FIELD_LENGTH));
    offset += FIELD_LENGTH;
    final Address relayer = new Address(ByteUtils.slice(bytes, offset, FIELD_LENGTH));
    offset += FIELD_LENGTH;
    final long fee = ByteUtils.readU64(bytes, offset);
    offset += 8;
    final long refund = ByteUtils.readU64(bytes, offset);
    offset += 8;
    final long proofLength = ByteUtils.readU32(bytes, offset);
    offset += 4;
    if (proofLength != bytes.length - offset) {
      throw new IllegalArgumentException("Proof length mismatch: " + proofLength);
    }
    final byte[] proof = ByteUtils.slice(bytes, offset, (int) proofLength);
    return new WithdrawOperation(poolId, root, nullifierHash, recipient, relayer, fee, refund, proof);
  }

  @Override
  public byte opcode() {
    return OPCODE;
  }

  @Override
  public byte[] serialize() {
    final byte[] out = new byte[HEADER_SIZE + proof.length];
    out[0] = OPCODE;
    int offset = 1;
    for (byte[] field : new byte[][]{poolId.bytes(), root, nullifierHash, recipient.bytes(), relayer.bytes()}) {
      System.arraycopy(field, 0, out, offset, FIELD_LENGTH);
      offset += FIELD_LENGTH;
    }
    ByteUtils.writeU64(out, offset, fee);
    offset += 8;
    ByteUtils.writeU64(out, offset, refund);
    offset += 8;
    ByteUtils.writeU32(out, offset, proof.length);
    offset += 4;
    System.arraycopy(proof, 0, out, offset, proof.length);
    return out;
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
  public byte[] proof() {
    return proof.clone();
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof WithdrawOperation other
        && fee == other.fee
        && refund == other.refund
        && poolId.equals(other.poolId)
        && Arrays.equals(root, other.root)
        && Arrays.equals(nullifierHash, other.nullifierHash)
        && recipient.equals(other.recipient)
        && relayer.equals(other.relayer)
        && Arrays.equals(proof, other.proof);
  }

  @Override
  public int hashCode() {
    return Objects.hash(poolId, Arrays.hashCode(root), Arrays.hashCode(nullifierHash), recipient, relayer,
        fee, refund, Arrays.hashCode(proof));
  }

  @Override
  public String toString() {
    return "WithdrawOperation{poolId=" + poolId + ", nullifierHash=" + Hex.toHexString(nullifierHash)
        + ", recipient=" + recipient + ", relayer=" + relayer + ", fee=" + fee + "}";
  }
}
