package com.codeheadsystems.veil.ledger;

/**
 * Selects program-owned accounts by their leading discriminator byte and exact data size.
 *
 * @param discriminator the discriminator
 * @param dataSize      the data size
 */
public record AccountFilter(int discriminator, int dataSize) {

  /**
   * Whether the raw account data passes this filter.
   *
   * @param data the data
   * @return the boolean
   */
  public boolean matches(final byte[] data) {
    return data != null && data.length == dataSize && (data[0] & 0xFF) == discriminator;
  }
}
