package com.chauhraj.kdbtick.datatypes;

import java.util.Arrays;
import java.util.Objects;

/**
 * A vector, list or table together with a non-default {@link Attribute}. A sorted dictionary
 * (wire type 127) is an {@code Attributed} {@link Dict} with {@link Attribute#SORTED}.
 * Values read with no attribute are returned bare, never wrapped.
 */
public final class Attributed {
  public final Attribute attribute;
  public final Object value;

  public Attributed(Attribute attribute, Object value) {
    Objects.requireNonNull(attribute);
    Objects.requireNonNull(value);
    if (value instanceof Attributed)
      throw new IllegalArgumentException("Value already carries an attribute");
    if (value instanceof Dict) {
      if (attribute != Attribute.SORTED)
        throw new IllegalArgumentException("Only the sorted attribute applies to a dictionary");
    } else if (KType.of(value).code() < 0 || KType.of(value).code() > 98) {
      throw new IllegalArgumentException("Attributes apply to vectors, lists and tables, not " + value.getClass().getName());
    }
    this.attribute = attribute;
    this.value = value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Attributed)) return false;
    Attributed a = (Attributed) o;
    return attribute == a.attribute && Objects.deepEquals(value, a.value);
  }

  @Override
  public int hashCode() {
    return 31 * attribute.hashCode() + Arrays.deepHashCode(new Object[] {value});
  }

  @Override
  public String toString() {
    return attribute + "#" + Arrays.deepToString(new Object[] {value});
  }
}
