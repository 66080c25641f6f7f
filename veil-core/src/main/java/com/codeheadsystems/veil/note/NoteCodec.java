package com.codeheadsystems.veil.note;

import com.codeheadsystems.veil.common.ByteUtils;
import com.codeheadsystems.veil.exceptions.InvalidNoteFormatException;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.DepositNote;
import com.codeheadsystems.veil.model.TokenType;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;

/**
 * Encodes and decodes the note strings handed to users.
 * <p>
 * Layout (v2, the current writer):
 * <pre>
 * veilnote-2-&lt;pool hex&gt;-&lt;token&gt;-&lt;denomination&gt;-&lt;secret hex&gt;-&lt;nullifier hex&gt;-&lt;timestamp&gt;-&lt;recipient hex|none&gt;-&lt;checksum&gt;
 * </pre>
 * The checksum is the first four bytes of SHA-256 over everything before the final delimiter.
 * Version 1 strings (no checksum, trailing recipient optional) remain readable.
 */
public class NoteCodec {

  /**
   * The magic prefix.
   */
  public static final String PREFIX = "veilnote";
  /**
   * Field delimiter.
   */
  public static final char DELIMITER = '-';

  private static final String NO_RECIPIENT = "none";
  private static final int CHECKSUM_LENGTH = 4;

  private final NoteVersion writeVersion;

  /**
   * Codec writing the current version.
   */
  public NoteCodec() {
    this(NoteVersion.V2);
  }

  /**
   * Codec writing the given version.
   *
   * @param writeVersion the write version
   */
  public NoteCodec(final NoteVersion writeVersion) {
    this.writeVersion = writeVersion;
  }

  /**
   * Encode a note.
   *
   * @param note the note
   * @return the string
   */
  public String encode(final DepositNote note) {
    final StringBuilder sb = new StringBuilder(PREFIX)
        .append(DELIMITER).append(writeVersion.tag())
        .append(DELIMITER).append(note.poolId().toHex())
        .append(DELIMITER).append(note.tokenType().name().toLowerCase(Locale.ROOT))
        .append(DELIMITER).append(note.denomination())
        .append(DELIMITER).append(Hex.toHexString(note.secret()))
        .append(DELIMITER).append(Hex.toHexString(note.nullifierPreimage()))
        .append(DELIMITER).append(note.timestamp());
    if (writeVersion == NoteVersion.V1) {
      if (note.recipient() != null) {
        sb.append(DELIMITER).append(note.recipient().toHex());
      }
      return sb.toString();
    }
    sb.append(DELIMITER).append(note.recipient() == null ? NO_RECIPIENT : note.recipient().toHex());
    final String body = sb.toString();
    return body + DELIMITER + checksum(body);
  }

  /**
   * Decode a note string of any supported version.
   *
   * @param text the text
   * @return the deposit note
   * @throws InvalidNoteFormatException if the string is not a well-formed note
   */
  public DepositNote decode(final String text) {
    if (text == null || text.isBlank()) {
      throw new InvalidNoteFormatException("Note is empty");
    }
    final String trimmed = text.trim();
    final String[] fields = trimmed.split(String.valueOf(DELIMITER), -1);
    if (fields.length < 2 || !PREFIX.equals(fields[0])) {
      throw new InvalidNoteFormatException("Missing note prefix");
    }
    final NoteVersion version = NoteVersion.fromTag(fields[1]);
    if (version == null) {
      throw new InvalidNoteFormatException("Unsupported note version: " + fields[1]);
    }
    if (!version.acceptsFieldCount(fields.length)) {
      throw new InvalidNoteFormatException("Wrong field count for note version " + version.tag()
          + ": " + fields.length);
    }
    if (version == NoteVersion.V2) {
      final int cut = trimmed.lastIndexOf(DELIMITER);
      final String expected = checksum(trimmed.substring(0, cut));
      if (!expected.equals(fields[9].toLowerCase(Locale.ROOT))) {
        throw new InvalidNoteFormatException("Note checksum mismatch");
      }
    }

    final Address poolId = parseAddress(fields[2], "pool id");
    final TokenType tokenType = parseToken(fields[3]);
    final long denomination = parsePositiveLong(fields[4], "denomination");
    final byte[] secret = parseField(fields[5], "secret");
    final byte[] nullifier = parseField(fields[6], "nullifier");
    final long timestamp = parseNonNegativeLong(fields[7], "timestamp");
    Address recipient = null;
    if (fields.length > 8 && !NO_RECIPIENT.equals(fields[8])) {
      recipient = parseAddress(fields[8], "recipient");
    }
    return new DepositNote(poolId, tokenType, denomination, secret, nullifier, timestamp, recipient);
  }

  /**
   * True if the text decodes.
   *
   * @param text the text
   * @return the boolean
   */
  public boolean isValid(final String text) {
    try {
      decode(text);
      return true;
    } catch (InvalidNoteFormatException e) {
      return false;
    }
  }

  // ─── Helpers ────────────────────────────────────────────────────────────────

  static String checksum(final String body) {
    final byte[] input = body.getBytes(StandardCharsets.US_ASCII);
    final SHA256Digest digest = new SHA256Digest();
    digest.update(input, 0, input.length);
    final byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return Hex.toHexString(Arrays.copyOf(out, CHECKSUM_LENGTH));
  }

  private static byte[] parseField(final String hex, final String name) {
    if (hex.length() != ByteUtils.FIELD_LENGTH * 2 || !isHex(hex)) {
      throw new InvalidNoteFormatException("Malformed " + name + " field");
    }
    return Hex.decode(hex);
  }

  private static Address parseAddress(final String hex, final String name) {
    return new Address(parseField(hex, name));
  }

  private static TokenType parseToken(final String value) {
    try {
      return TokenType.fromName(value);
    } catch (IllegalArgumentException e) {
      throw new InvalidNoteFormatException("Unknown token type: " + value, e);
    }
  }

  private static long parsePositiveLong(final String value, final String name) {
    final long parsed = parseNonNegativeLong(value, name);
    if (parsed == 0) {
      throw new InvalidNoteFormatException(name + " must be positive");
    }
    return parsed;
  }

  private static long parseNonNegativeLong(final String value, final String name) {
    if (value.isEmpty() || !value.chars().allMatch(c -> c >= '0' && c <= '9')) {
      throw new InvalidNoteFormatException("Malformed " + name + " field");
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new InvalidNoteFormatException("Malformed " + name + " field", e);
    }
  }

  private static boolean isHex(final String value) {
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      final boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
      if (!hex) {
        return false;
      }
    }
    return true;
  }
}
