package com.codeheadsystems.veil.circuit;

import static com.codeheadsystems.veil.common.ByteUtils.concat;

import com.codeheadsystems.veil.common.ByteUtils;
import com.codeheadsystems.veil.model.Address;
import java.util.List;

/**
 * The positional input vector for the withdrawal circuit. Private inputs: nullifier preimage,
 * secret, siblings, path bits. Public inputs: root, nullifier hash, recipient, relayer, fee.
 * <p>
 * Instances are only produced by {@link CircuitInputBuilder}, which validates the shape.
 *
 * @param nullifierPreimage the nullifier preimage
 * @param secret            the secret
 * @param siblings          the siblings, leaf level first
 * @param pathBits          the path bits, least significant first
 * @param root              the root
 * @param nullifierHash     the nullifier hash
 * @param recipient         the recipient
 * @param relayer           the relayer
 * @param fee               the fee
 * @param commitmentRecipient the recipient bound into the commitment, or null
 */
public record CircuitInputs(byte[] nullifierPreimage,
                            byte[] secret,
                            List<byte[]> siblings,
                            int[] pathBits,
                            byte[] root,
                            byte[] nullifierHash,
                            Address recipient,
                            Address relayer,
                            long fee,
                            Address commitmentRecipient) {

  @Override
  public byte[] nullifierPreimage() {
    return nullifierPreimage.clone();
  }

  @Override
  public byte[] secret() {
    return secret.clone();
  }

  @Override
  public int[] pathBits() {
    return pathBits.clone();
  }

  @Override
  public byte[] root() {
    return root.clone();
  }

  @Override
  public byte[] nullifierHash() {
    return nullifierHash.clone();
  }

  /**
   * The public signals these inputs must produce.
   *
   * @return the public signals
   */
  public PublicSignals expectedSignals() {
    return new PublicSignals(root, nullifierHash, recipient, relayer, fee);
  }

  /**
   * Fixed-order byte encoding of the whole vector. Two input vectors encode equally only if
   * every field is equal, which makes this the proof cache fingerprint input.
   *
   * @return the byte [ ]
   */
  public byte[] canonicalEncoding() {
    final byte[] bits = new byte[pathBits.length];
    for (int i = 0; i < pathBits.length; i++) {
      bits[i] = (byte) pathBits[i];
    }
    final byte[] counts = new byte[12];
    ByteUtils.writeU32(counts, 0, siblings.size());
    ByteUtils.writeU64(counts, 4, fee);
    final byte[] bound = commitmentRecipient == null ? new byte[ByteUtils.FIELD_LENGTH] : commitmentRecipient.bytes();
    return concat(nullifierPreimage, secret, concat(siblings.toArray(new byte[0][])), bits, root,
        nullifierHash, recipient.bytes(), relayer.bytes(), counts, bound);
  }

  @Override
  public String toString() {
    return "CircuitInputs{depth=" + siblings.size() + ", recipient=" + recipient + ", relayer=" + relayer
        + ", fee=" + fee + ", private=<redacted>}";
  }
}
