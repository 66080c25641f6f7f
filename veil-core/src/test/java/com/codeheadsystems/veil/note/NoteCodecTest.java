package com.codeheadsystems.veil.note;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.veil.common.RandomProvider;
import com.codeheadsystems.veil.exceptions.InvalidNoteFormatException;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.DepositNote;
import com.codeheadsystems.veil.model.TokenType;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class NoteCodecTest {

  private static final RandomProvider RANDOM = new RandomProvider();

  private static DepositNote randomNote(TokenType token, long denomination, Address recipient) {
    return new DepositNote(new Address(RANDOM.randomBytes(32)), token, denomination,
        RANDOM.randomBytes(32), RANDOM.randomBytes(32), 1_700_000_000_000L, recipient);
  }

  static Stream<Arguments> notes() {
    List<Arguments> args = new ArrayList<>();
    for (NoteVersion version : NoteVersion.values()) {
      for (TokenType token : TokenType.values()) {
        args.add(Arguments.of(version, randomNote(token, token.denominations().get(0), null)));
        args.add(Arguments.of(version, randomNote(token, token.denominations().get(1),
            new Address(RANDOM.randomBytes(32)))));
      }
    }
    return args.stream();
  }

  @ParameterizedTest
  @MethodSource("notes")
  void decode_inverseOfEncode(NoteVersion version, DepositNote note) {
    NoteCodec codec = new NoteCodec(version);
    assertThat(codec.decode(codec.encode(note))).isEqualTo(note);
  }

  @Test
  void encode_defaultsToV2WithNoneRecipientAndChecksum() {
    String text = new NoteCodec().encode(randomNote(TokenType.SOL, 100_000_000L, null));
    String[] fields = text.split("-");
    assertThat(fields[0]).isEqualTo("veilnote");
    assertThat(fields[1]).isEqualTo("2");
    assertThat(fields[3]).isEqualTo("sol");
    assertThat(fields[8]).isEqualTo("none");
    assertThat(fields[9]).hasSize(8);
  }

  @Test
  void decode_v1WithoutRecipient_isReadableByCurrentCodec() {
    DepositNote note = randomNote(TokenType.USDC, 1_000_000L, null);
    String v1 = new NoteCodec(NoteVersion.V1).encode(note);
    assertThat(v1.split("-")).hasSize(8);
    assertThat(new NoteCodec().decode(v1)).isEqualTo(note);
  }

  @Test
  void decode_checksumMismatch_throws() {
    String text = new NoteCodec().encode(randomNote(TokenType.SOL, 100_000_000L, null));
    // Flip one character of the secret field.
    int pos = text.indexOf("-sol-") + 20;
    char flipped = text.charAt(pos) == 'a' ? 'b' : 'a';
    String tampered = text.substring(0, pos) + flipped + text.substring(pos + 1);
    assertThatThrownBy(() -> new NoteCodec().decode(tampered))
        .isInstanceOf(InvalidNoteFormatException.class)
        .hasMessageContaining("checksum");
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "",
      "   ",
      "notanote",
      "veilnote-9-aa",
      "veilnote-1-aa-sol-1-bb-cc-0",
      "tornado-1-00-sol-1-00-00-0"
  })
  void decode_malformed_throwsInvalidNoteFormat(String text) {
    assertThatThrownBy(() -> new NoteCodec().decode(text)).isInstanceOf(InvalidNoteFormatException.class);
  }

  @Test
  void decode_unknownToken_throwsInvalidNoteFormat() {
    String text = new NoteCodec(NoteVersion.V1).encode(randomNote(TokenType.SOL, 100_000_000L, null))
        .replace("-sol-", "-doge-");
    assertThatThrownBy(() -> new NoteCodec().decode(text))
        .isInstanceOf(InvalidNoteFormatException.class)
        .hasMessageContaining("token");
  }

  @Test
  void decode_zeroDenomination_throwsInvalidNoteFormat() {
    DepositNote note = randomNote(TokenType.SOL, 100_000_000L, null);
    String text = new NoteCodec(NoteVersion.V1).encode(note).replace("-100000000-", "-0-");
    assertThatThrownBy(() -> new NoteCodec().decode(text)).isInstanceOf(InvalidNoteFormatException.class);
  }

  @Test
  void decode_null_throwsInvalidNoteFormat() {
    assertThatThrownBy(() -> new NoteCodec().decode(null)).isInstanceOf(InvalidNoteFormatException.class);
  }

  @Test
  void isValid_reportsWithoutThrowing() {
    NoteCodec codec = new NoteCodec();
    assertThat(codec.isValid(codec.encode(randomNote(TokenType.SOL, 100_000_000L, null)))).isTrue();
    assertThat(codec.isValid("garbage")).isFalse();
  }
}
