package com.chauhraj.kdbtick.datatypes;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import org.agrona.collections.Hashing;
import org.agrona.collections.Int2ObjectHashMap;
import org.agrona.collections.Object2ObjectHashMap;

/**
 * Every kdb+ wire type, with its numeric code, element width and type letter.
 * See data type reference <a href="https://code.kx.com/q/basics/datatypes/">https://code.kx.com/q/basics/datatypes/</a>
 * <p>
 * Atoms have negative codes, vectors the matching positive code. Element width is the number of bytes per
 * element on the wire, 0 where it is variable.
 * </p>
 */
public enum KType {
  // Atoms
  BOOLEAN(-1, 1, 'b'),
  GUID(-2, 16, 'g'),
  BYTE(-4, 1, 'x'),
  SHORT(-5, 2, 'h'),
  INT(-6, 4, 'i'),
  LONG(-7, 8, 'j'),
  REAL(-8, 4, 'e'),
  FLOAT(-9, 8, 'f'),
  CHAR(-10, 1, 'c'),
  SYMBOL(-11, 0, 's'),
  TIMESTAMP(-12, 8, 'p'),
  MONTH(-13, 4, 'm'),
  DATE(-14, 4, 'd'),
  DATETIME(-15, 8, 'z'),
  TIMESPAN(-16, 8, 'n'),
  MINUTE(-17, 4, 'u'),
  SECOND(-18, 4, 'v'),
  TIME(-19, 4, 't'),

  LIST(0, 0, ' '),

  // Vectors
  BOOLEAN_VECTOR(1, 1, 'b'),
  GUID_VECTOR(2, 16, 'g'),
  BYTE_VECTOR(4, 1, 'x'),
  SHORT_VECTOR(5, 2, 'h'),
  INT_VECTOR(6, 4, 'i'),
  LONG_VECTOR(7, 8, 'j'),
  REAL_VECTOR(8, 4, 'e'),
  FLOAT_VECTOR(9, 8, 'f'),
  CHAR_VECTOR(10, 1, 'c'),
  SYMBOL_VECTOR(11, 0, 's'),
  TIMESTAMP_VECTOR(12, 8, 'p'),
  MONTH_VECTOR(13, 4, 'm'),
  DATE_VECTOR(14, 4, 'd'),
  DATETIME_VECTOR(15, 8, 'z'),
  TIMESPAN_VECTOR(16, 8, 'n'),
  MINUTE_VECTOR(17, 4, 'u'),
  SECOND_VECTOR(18, 4, 'v'),
  TIME_VECTOR(19, 4, 't'),

  TABLE(98, 0, ' '),
  DICT(99, 0, ' '),

  // Functions, decoded structurally only
  LAMBDA(100, 0, ' '),
  UNARY_PRIMITIVE(101, 0, ' '),
  BINARY_PRIMITIVE(102, 0, ' '),
  TERNARY_OPERATOR(103, 0, ' '),
  PROJECTION(104, 0, ' '),
  COMPOSITION(105, 0, ' '),
  EACH(106, 0, ' '),
  OVER(107, 0, ' '),
  SCAN(108, 0, ' '),
  EACH_PRIOR(109, 0, ' '),
  EACH_RIGHT(110, 0, ' '),
  EACH_LEFT(111, 0, ' '),
  DYNAMIC_LOAD(112, 0, ' '),

  SORTED_DICT(127, 0, ' '),

  /** Leading byte of an error response body. */
  ERROR(-128, 0, ' ');

  private static final Int2ObjectHashMap<KType> BY_CODE = new Int2ObjectHashMap<>(128, Hashing.DEFAULT_LOAD_FACTOR);
  private static final Object2ObjectHashMap<Class<?>, KType> BY_CLASS = new Object2ObjectHashMap<>(64, Hashing.DEFAULT_LOAD_FACTOR);

  static {
    for (KType type : values())
      BY_CODE.put(type.code, type);

    BY_CLASS.put(Boolean.class, BOOLEAN);
    BY_CLASS.put(UUID.class, GUID);
    BY_CLASS.put(Byte.class, BYTE);
    BY_CLASS.put(Short.class, SHORT);
    BY_CLASS.put(Integer.class, INT);
    BY_CLASS.put(Long.class, LONG);
    BY_CLASS.put(Float.class, REAL);
    BY_CLASS.put(Double.class, FLOAT);
    BY_CLASS.put(Character.class, CHAR);
    BY_CLASS.put(String.class, SYMBOL);
    BY_CLASS.put(Instant.class, TIMESTAMP);
    BY_CLASS.put(Month.class, MONTH);
    BY_CLASS.put(LocalDate.class, DATE);
    BY_CLASS.put(LocalDateTime.class, DATETIME);
    BY_CLASS.put(Timespan.class, TIMESPAN);
    BY_CLASS.put(Minute.class, MINUTE);
    BY_CLASS.put(Second.class, SECOND);
    BY_CLASS.put(LocalTime.class, TIME);

    BY_CLASS.put(boolean[].class, BOOLEAN_VECTOR);
    BY_CLASS.put(UUID[].class, GUID_VECTOR);
    BY_CLASS.put(byte[].class, BYTE_VECTOR);
    BY_CLASS.put(short[].class, SHORT_VECTOR);
    BY_CLASS.put(int[].class, INT_VECTOR);
    BY_CLASS.put(long[].class, LONG_VECTOR);
    BY_CLASS.put(float[].class, REAL_VECTOR);
    BY_CLASS.put(double[].class, FLOAT_VECTOR);
    BY_CLASS.put(char[].class, CHAR_VECTOR);
    BY_CLASS.put(CharVector.class, CHAR_VECTOR);
    BY_CLASS.put(String[].class, SYMBOL_VECTOR);
    BY_CLASS.put(Instant[].class, TIMESTAMP_VECTOR);
    BY_CLASS.put(Month[].class, MONTH_VECTOR);
    BY_CLASS.put(LocalDate[].class, DATE_VECTOR);
    BY_CLASS.put(LocalDateTime[].class, DATETIME_VECTOR);
    BY_CLASS.put(Timespan[].class, TIMESPAN_VECTOR);
    BY_CLASS.put(Minute[].class, MINUTE_VECTOR);
    BY_CLASS.put(Second[].class, SECOND_VECTOR);
    BY_CLASS.put(LocalTime[].class, TIME_VECTOR);

    BY_CLASS.put(Flip.class, TABLE);
    BY_CLASS.put(Dict.class, DICT);
  }

  private static final ClassValue<KType> TYPE_CACHE = new ClassValue<>() {
    @Override
    protected KType computeValue(Class<?> type) {
      KType t = BY_CLASS.get(type);
      // Object[], boxed arrays, java.util.List and anything unrecognised are general lists
      return t != null ? t : LIST;
    }
  };

  private final int code;
  private final int size;
  private final char typeChar;

  KType(int code, int size, char typeChar) {
    this.code = code;
    this.size = size;
    this.typeChar = typeChar;
  }

  /** The numeric type code used on the wire. */
  public int code() {
    return code;
  }

  /** Bytes per element on the wire; 0 when variable. */
  public int size() {
    return size;
  }

  /** The q type letter, or a space for types without one. */
  public char typeChar() {
    return typeChar;
  }

  public boolean isAtom() {
    return code < 0 && code > -20;
  }

  public boolean isVector() {
    return code > 0 && code < 20;
  }

  public boolean isFunction() {
    return code >= 100 && code <= 112;
  }

  /**
   * @return the vector type for an atom type, or this type if it is already a vector
   * @throws IllegalStateException for non-primitive types
   */
  public KType vector() {
    if (isVector())
      return this;
    if (!isAtom())
      throw new IllegalStateException(this + " has no vector form");
    return BY_CODE.get(-code);
  }

  /**
   * Finds the type for a wire code.
   * @param code the type code read from the wire
   * @return the matching type, or {@code null} for a code kdb+ does not define
   */
  public static KType fromCode(int code) {
    return BY_CODE.get(code);
  }

  /**
   * Maps a Java value to its wire type. This is a total function: values with no specific mapping,
   * including {@code Object[]}, boxed arrays and {@link List}, are general lists. A Java {@code null}
   * is the generic null {@code ::}, a unary primitive.
   * @param x the value
   * @return its wire type
   */
  public static KType of(final Object x) {
    if (x == null)
      return UNARY_PRIMITIVE;
    if (x instanceof Attributed) {
      Attributed a = (Attributed) x;
      return a.value instanceof Dict ? SORTED_DICT : of(a.value);
    }
    if (x instanceof Function)
      return ((Function) x).type();
    return TYPE_CACHE.get(x.getClass());
  }

  /**
   * Gets the numeric type of the supplied object used in kdb+. For example, an {@link Integer} has type -6.
   * @param x object to get the numeric type of
   * @return kdb+ type number for the object
   */
  public static int typeCode(final Object x) {
    return of(x).code;
  }
}
