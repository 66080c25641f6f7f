package com.codeheadsystems.veil.common;

import java.util.Arrays;

/**
 * Utility methods for fixed-width byte fields and little-endian integer encoding.
 * <p>
 * Ledger account and operation layouts are little-endian; everything else in this project treats
 * byte arrays as opaque octet strings.
 */
public class ByteUtils {

  /**
   * Width of every hash, key and address field handled by the protocol.
   */
  public static final int FIELD_LENGTH = 32;

  private ByteUtils() {
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Returns the input unchanged if it has exactly {@code length} bytes.
   *
   * @param value  the value
   * @param length the expected length
   * @param name   field name used in the error message
   * @return the value
   * @throws IllegalArgumentException if the value is null or has the wrong length
   */
  public static byte[] requireLength(byte[] value, int length, String name) {
    if (value == null) {
      throw new IllegalArgumentException(name + " is required");
    }
    if (value.length != length) {
      throw new IllegalArgumentException(name + " must be " + length + " bytes, was " + value.length);
    }
    return value;
  }

  /**
   * True when every byte is zero. An empty array counts as zero.
   *
   * @param value the value
   * @return the boolean
   */
  public static boolean isZero(byte[] value) {
    for (byte b : value) {
      if (b != 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Lexicographic unsigned comparison, used to order ids deterministically.
   *
   * @param a the a
   * @param b the b
   * @return negative, zero or positive
   */
  public static int compareUnsigned(byte[] a, byte[] b) {
    return Arrays.compareUnsigned(a, b);
  }

  /**
   * Writes an unsigned 16-bit value little-endian.
   *
   * @param target the target
   * @param offset the offset
   * @param value  the value (0..65535)
   */
  public static void writeU16(byte[] target, int offset, int value) {
    if (value < 0 || value > 0xFFFF) {
      throw new IllegalArgumentException("Value does not fit in u16: " + value);
    }
    target[offset] = (byte) value;
    target[offset + 1] = (byte) (value >>> 8);
  }

  /**
   * Reads an unsigned 16-bit little-endian value.
   *
   * @param source the source
   * @param offset the offset
   * @return the int
   */
  public static int readU16(byte[] source, int offset) {
    return (source[offset] & 0xFF) | ((source[offset + 1] & 0xFF) << 8);
  }

  /**
   * Writes an unsigned 32-bit value little-endian.
   *
   * @param target the target
   * @param offset the offset
   * @param value  the value
   */
  public static void writeU32(byte[] target, int offset, long value) {
    if (value < 0 || value > 0xFFFFFFFFL) {
      throw new IllegalArgumentException("Value does not fit in u32: " + value);
    }
    for (int i = 0; i < 4; i++) {
      target[offset + i] = (byte) (value >>> (8 * i));
    }
  }

  /**
   * Reads an unsigned 32-bit little-endian value.
   *
   * @param source the source
   * @param offset the offset
   * @return the long
   */
  public static long readU32(byte[] source, int offset) {
    long result = 0;
    for (int i = 3; i >= 0; i--) {
      result = (result << 8) | (source[offset + i] & 0xFF);
    }
    return result;
  }

  /**
   * Writes a 64-bit value little-endian. Amounts never exceed {@link Long#MAX_VALUE}.
   *
   * @param target the target
   * @param offset the offset
   * @param value  the value
   */
  public static void writeU64(byte[] target, int offset, long value) {
    for (int i = 0; i < 8; i++) {
      target[offset + i] = (byte) (value >>> (8 * i));
    }
  }

  /**
   * Reads a 64-bit little-endian value.
   *
   * @param source the source
   * @param offset the offset
   * @return the long
   */
  public static long readU64(byte[] source, int offset) {
    long result = 0;
    for (int i = 7; i >= 0; i--) {
      result = (result << 8) | (source[offset + i] & 0xFF);
    }
    return result;
  }

  /**
   * Copies {@code length} bytes starting at {@code offset}.
   *
   * @param source the source
   * @param offset the offset
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] slice(byte[] source, int offset, int length) {
    return Arrays.copyOfRange(source, offset, offset + length);
  }
}
