package com.chauhraj.kdbtick.datatypes;

import java.lang.reflect.Array;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.UUID;

/**
 * Typed null values. kdb+ has no untyped null for primitive types; each type reserves one value instead.
 * Booleans and bytes have no null, so their "null" is the zero value and never tests as null.
 */
public final class Nulls {

  /** null int, i.e. 0Ni */
  public static final int NULL_INT = Integer.MIN_VALUE;
  /** null long, i.e. 0N */
  public static final long NULL_LONG = Long.MIN_VALUE;
  /** null float, i.e. 0n */
  public static final double NULL_FLOAT = Double.NaN;
  /**
   * null time, i.e. 0Nt. The wire carries milliseconds, so no time read from kdb+ collides with it.
   * A caller's {@code LocalTime.of(0, 0, 0, 1)} is this value and is sent as 0Nt; truncate to
   * milliseconds first to send 00:00:00.000 instead.
   */
  public static final LocalTime NULL_TIME = LocalTime.of(0, 0, 0, 1);

  private static final String TYPE_CHARS = " bg xhijefcspmdznuvt";

  private Nulls() {
  }

  /**
   * Gets the null value for the type indicated by the character.
   * See data type reference <a href="https://code.kx.com/q/basics/datatypes/">https://code.kx.com/q/basics/datatypes/</a>
   * @param c the q type letter, or a space for the general null
   * @return the null of that type; {@code null} for the general null
   * @throws IllegalArgumentException for an unknown type letter
   */
  public static Object NULL(char c) {
    switch (c) {
      case ' ': return null;
      case 'b': return Boolean.FALSE;
      case 'g': return new UUID(0, 0);
      case 'x': return (byte) 0;
      case 'h': return Short.MIN_VALUE;
      case 'i': return NULL_INT;
      case 'j': return NULL_LONG;
      case 'e': return Float.NaN;
      case 'f': return NULL_FLOAT;
      case 'c': return ' ';
      case 's': return "";
      case 'p': return Instant.MIN;
      case 'm': return Month.NULL;
      case 'd': return LocalDate.MIN;
      case 'z': return LocalDateTime.MIN;
      case 'n': return Timespan.NULL;
      case 'u': return Minute.NULL;
      case 'v': return Second.NULL;
      case 't': return NULL_TIME;
      default:
        throw new IllegalArgumentException("Unknown type char '" + c + "', expected one of \"" + TYPE_CHARS + "\"");
    }
  }

  /**
   * Tests whether an object represents a kdb+ null for its type, e.g. {@code isNull(NULL('j'))} is true.
   * @param x the object to test
   * @return true if {@code x} is a typed null or the general null
   */
  public static boolean isNull(Object x) {
    KType type = KType.of(x);
    if (x == null)
      return true;
    if (!type.isAtom() || type == KType.BOOLEAN || type == KType.BYTE)
      return false;
    return x.equals(NULL(type.typeChar()));
  }

  /**
   * Gets the element at an index of a vector, mapping typed nulls to {@code null}.
   * @param x the vector
   * @param i the index
   * @return the element, or {@code null} if it is the typed null
   */
  public static Object at(Object x, int i) {
    Object v = Array.get(x, i);
    return isNull(v) ? null : v;
  }

  /**
   * Sets the element at an index of a vector; {@code null} stores the typed null of the vector.
   * @param x the vector
   * @param i the index
   * @param y the value, or {@code null}
   */
  public static void set(Object x, int i, Object y) {
    Array.set(x, i, y == null ? NULL(KType.of(x).typeChar()) : y);
  }
}
