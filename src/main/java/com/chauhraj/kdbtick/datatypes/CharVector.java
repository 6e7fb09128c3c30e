package com.chauhraj.kdbtick.datatypes;

/**
 * A string sent as a kdb+ char vector (type 10) rather than a symbol (type -11).
 * <p>
 * A plain {@link String} serializes as a symbol. kdb+ evaluates a char vector as an expression, so function
 * names and query text must travel in this form, while table and column names travel as symbols.
 * </p>
 */
public final class CharVector implements CharSequence {
  private final String value;

  public CharVector(String value) {
    this.value = value;
  }

  public CharVector(char[] chars) {
    this(new String(chars));
  }

  @Override
  public int length() {
    return value.length();
  }

  @Override
  public char charAt(int index) {
    return value.charAt(index);
  }

  @Override
  public CharSequence subSequence(int start, int end) {
    return new CharVector(value.substring(start, end));
  }

  @Override
  public String toString() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof CharVector && ((CharVector) o).value.equals(value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }
}
