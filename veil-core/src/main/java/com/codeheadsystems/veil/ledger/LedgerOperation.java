package com.codeheadsystems.veil.ledger;

/**
 * A binary instruction payload submitted to the ledger: one opcode byte followed by fixed-width
 * little-endian fields. Any layout change is a breaking protocol change.
 */
public interface LedgerOperation {

  /**
   * The opcode byte.
   *
   * @return the byte
   */
  byte opcode();

  /**
   * Wire bytes, opcode first.
   *
   * @return the byte [ ]
   */
  byte[] serialize();

  /**
   * Decodes any known operation by its opcode.
   *
   * @param bytes the bytes
   * @return the ledger operation
   */
  static LedgerOperation deserialize(final byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      throw new IllegalArgumentException("Empty operation");
    }
    return switch (bytes[0]) {
      case DepositOperation.OPCODE -> DepositOperation.deserialize(bytes);
      case WithdrawOperation.OPCODE -> WithdrawOperation.deserialize(bytes);
      default -> throw new IllegalArgumentException("Unknown opcode: " + bytes[0]);
    };
  }
}
