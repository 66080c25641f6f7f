package com.codeheadsystems.veil.commitment;

import com.codeheadsystems.veil.common.ByteUtils;
import com.codeheadsystems.veil.common.RandomProvider;

/**
 * Generates note secrets and nullifier preimages.
 */
public class SecretGenerator {

  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Secret generator.
   *
   * @param randomProvider the random provider
   */
  public SecretGenerator(final RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  /**
   * 32 random bytes.
   *
   * @return the byte [ ]
   */
  public byte[] generateSecret() {
    return randomProvider.randomBytes(ByteUtils.FIELD_LENGTH);
  }

  /**
   * 32 random bytes.
   *
   * @return the byte [ ]
   */
  public byte[] generateNullifierPreimage() {
    return randomProvider.randomBytes(ByteUtils.FIELD_LENGTH);
  }
}
