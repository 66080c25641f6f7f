package com.codeheadsystems.veil.exceptions;

import java.util.Map;

/**
 * The note string is not a note this codec understands. Raised before any network call.
 */
public class InvalidNoteFormatException extends VeilException {

  /**
   * Instantiates a new Invalid note format exception.
   *
   * @param message the message
   */
  public InvalidNoteFormatException(final String message) {
    super(ErrorKind.INVALID_NOTE_FORMAT, message, Map.of(), null);
  }

  /**
   * Instantiates a new Invalid note format exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public InvalidNoteFormatException(final String message, final Throwable cause) {
    super(ErrorKind.INVALID_NOTE_FORMAT, message, Map.of(), cause);
  }
}
