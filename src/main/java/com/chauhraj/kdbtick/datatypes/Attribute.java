package com.chauhraj.kdbtick.datatypes;

/**
 * Attribute byte carried by vectors, lists and tables. The codec preserves it and never interprets it.
 */
public enum Attribute {
  NONE(0),
  SORTED(1),
  UNIQUE(2),
  PARTED(3),
  GROUPED(5);

  private final byte code;

  Attribute(int code) {
    this.code = (byte) code;
  }

  public byte code() {
    return code;
  }

  /**
   * @param code the attribute byte read from the wire
   * @return the matching attribute
   * @throws IllegalArgumentException for an unknown attribute byte
   */
  public static Attribute fromCode(byte code) {
    for (Attribute a : values())
      if (a.code == code)
        return a;
    throw new IllegalArgumentException("Unknown attribute: " + code);
  }
}
