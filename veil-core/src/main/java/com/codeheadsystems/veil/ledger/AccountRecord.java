package com.codeheadsystems.veil.ledger;

import com.codeheadsystems.veil.model.Address;
import java.util.Objects;

/**
 * Raw program-owned account: its address and data.
 *
 * @param address the address
 * @param data    the data
 */
public record AccountRecord(Address address, byte[] data) {

  /**
   * Instantiates a new Account record.
   */
  public AccountRecord {
    Objects.requireNonNull(address, "address");
    Objects.requireNonNull(data, "data");
    data = data.clone();
  }

  @Override
  public byte[] data() {
    return data.clone();
  }
}
