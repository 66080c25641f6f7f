package com.codeheadsystems.veil.note;

/**
 * Note string layouts. Field order within a version never changes.
 * <ul>
 *   <li>{@code V1}: prefix, version, pool, token, denomination, secret, nullifier, timestamp,
 *   optional recipient</li>
 *   <li>{@code V2}: as V1 but the recipient slot is always present ({@code none} when absent)
 *   and a checksum closes the string</li>
 * </ul>
 */
public enum NoteVersion {
  V1("1", 8, 9),
  V2("2", 10, 10);

  private final String tag;
  private final int minFields;
  private final int maxFields;

  NoteVersion(final String tag, final int minFields, final int maxFields) {
    this.tag = tag;
    this.minFields = minFields;
    this.maxFields = maxFields;
  }

  /**
   * Version for the tag, or null when unknown.
   *
   * @param tag the tag
   * @return the note version
   */
  public static NoteVersion fromTag(final String tag) {
    for (NoteVersion v : values()) {
      if (v.tag.equals(tag)) {
        return v;
      }
    }
    return null;
  }

  public String tag() {
    return tag;
  }

  boolean acceptsFieldCount(final int count) {
    return count >= minFields && count <= maxFields;
  }
}
