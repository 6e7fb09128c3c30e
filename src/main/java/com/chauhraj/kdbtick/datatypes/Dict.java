package com.chauhraj.kdbtick.datatypes;

import java.util.Arrays;
import java.util.Objects;

/**
 * Represents the kdb+ dictionary type (99), a mapping from a key value to a value value.
 * When both sides are vectors they must have the same count.
 * An introduction can be found at <a href="https://code.kx.com/q4m3/5_Dictionaries/">https://code.kx.com/q4m3/5_Dictionaries/</a>
 */
public final class Dict {
  /** Dict keys */
  public final Object x;
  /** Dict values */
  public final Object y;

  /**
   * @param keys keys to store; an array when holding more than one key
   * @param vals values to store, index aligned with {@code keys}
   */
  public Dict(Object keys, Object vals) {
    x = keys;
    y = vals;
  }

  @Override
  public String toString() {
    return "Dict{x=" + Arrays.deepToString(new Object[] {x}) + ", y=" + Arrays.deepToString(new Object[] {y}) + '}';
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (!(o instanceof Dict)) return false;
    Dict dict = (Dict) o;
    return Objects.deepEquals(x, dict.x) && Objects.deepEquals(y, dict.y);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(new Object[] {x, y});
  }
}
