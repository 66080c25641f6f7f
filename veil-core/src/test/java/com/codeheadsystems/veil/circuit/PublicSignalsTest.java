package com.codeheadsystems.veil.circuit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.veil.model.Address;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class PublicSignalsTest {

  @Test
  void signalStrings_areDecimalInVerifierOrder() {
    byte[] root = new byte[32];
    root[31] = 7;
    byte[] high = new byte[32];
    Arrays.fill(high, (byte) 0xFF);
    PublicSignals signals = new PublicSignals(root, high, Address.ZERO, Address.ZERO, 42L);

    List<String> strings = signals.toSignalStrings();
    assertThat(strings).hasSize(PublicSignals.COUNT);
    assertThat(strings.get(0)).isEqualTo("7");
    assertThat(strings.get(2)).isEqualTo("0");
    assertThat(strings.get(4)).isEqualTo("42");
    assertThat(PublicSignals.fromSignalStrings(strings)).isEqualTo(signals);
  }

  @Test
  void fromSignalStrings_wrongCount_throwsIAE() {
    assertThatThrownBy(() -> PublicSignals.fromSignalStrings(List.of("1", "2")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void fromSignalStrings_negative_throwsIAE() {
    assertThatThrownBy(() -> PublicSignals.fromSignalStrings(List.of("-1", "0", "0", "0", "0")))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
