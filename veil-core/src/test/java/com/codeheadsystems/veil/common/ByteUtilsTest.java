package com.codeheadsystems.veil.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ByteUtilsTest {

  // ─── concat / slice ───────────────────────────────────────────────────────

  @Test
  void concat_joinsInOrder() {
    assertThat(ByteUtils.concat(new byte[]{1}, new byte[0], new byte[]{2, 3})).containsExactly(1, 2, 3);
  }

  @Test
  void slice_copiesRange() {
    assertThat(ByteUtils.slice(new byte[]{1, 2, 3, 4}, 1, 2)).containsExactly(2, 3);
  }

  // ─── requireLength ────────────────────────────────────────────────────────

  @Test
  void requireLength_wrongLength_throwsIAE() {
    assertThatThrownBy(() -> ByteUtils.requireLength(new byte[3], 32, "secret"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("secret must be 32 bytes");
  }

  @Test
  void requireLength_null_throwsIAE() {
    assertThatThrownBy(() -> ByteUtils.requireLength(null, 32, "root"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("root is required");
  }

  // ─── little-endian integers ───────────────────────────────────────────────

  @Test
  void u16_isLittleEndian() {
    byte[] buf = new byte[2];
    ByteUtils.writeU16(buf, 0, 0x1234);
    assertThat(buf).containsExactly(0x34, 0x12);
    assertThat(ByteUtils.readU16(buf, 0)).isEqualTo(0x1234);
  }

  @Test
  void u16_outOfRange_throwsIAE() {
    assertThatThrownBy(() -> ByteUtils.writeU16(new byte[2], 0, 0x10000))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void u32_readsMaxValue() {
    byte[] buf = new byte[4];
    ByteUtils.writeU32(buf, 0, 0xFFFFFFFFL);
    assertThat(ByteUtils.readU32(buf, 0)).isEqualTo(0xFFFFFFFFL);
  }

  @Test
  void u64_atOffset() {
    byte[] buf = new byte[10];
    ByteUtils.writeU64(buf, 2, 1_000_000_000L);
    assertThat(buf[2]).isEqualTo((byte) 0x00);
    assertThat(buf[3]).isEqualTo((byte) 0xCA);
    assertThat(ByteUtils.readU64(buf, 2)).isEqualTo(1_000_000_000L);
  }

  @Test
  void isZero_detectsNonZero() {
    assertThat(ByteUtils.isZero(new byte[4])).isTrue();
    assertThat(ByteUtils.isZero(new byte[]{0, 0, 1})).isFalse();
  }

  @Test
  void compareUnsigned_treatsHighBitAsLarge() {
    assertThat(ByteUtils.compareUnsigned(new byte[]{(byte) 0x80}, new byte[]{0x01})).isPositive();
  }
}
