package com.codeheadsystems.veil.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class DepositNoteTest {

  private static DepositNote note(byte fill) {
    byte[] secret = new byte[32];
    secret[0] = fill;
    return new DepositNote(Address.ZERO, TokenType.SOL, 100_000_000L, secret, new byte[32], 1L, null);
  }

  @Test
  void equals_comparesArrayContent() {
    assertThat(note((byte) 1)).isEqualTo(note((byte) 1));
    assertThat(note((byte) 1)).isNotEqualTo(note((byte) 2));
  }

  @Test
  void toString_redactsSecret() {
    assertThat(note((byte) 1).toString()).contains("<redacted>").doesNotContain("secret=[");
  }

  @Test
  void wrongSecretLength_throwsIAE() {
    assertThatThrownBy(() -> new DepositNote(Address.ZERO, TokenType.SOL, 1L, new byte[5], new byte[32], 0L, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void boundRecipient_isEmptyWhenAbsent() {
    assertThat(note((byte) 1).boundRecipient()).isEmpty();
  }
}
