package com.chauhraj.kdbtick.protocol;

import java.lang.reflect.Array;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import com.chauhraj.kdbtick.datatypes.Attributed;
import com.chauhraj.kdbtick.datatypes.CharVector;
import com.chauhraj.kdbtick.datatypes.Dict;
import com.chauhraj.kdbtick.datatypes.Flip;
import com.chauhraj.kdbtick.datatypes.KType;
import com.chauhraj.kdbtick.datatypes.Minute;
import com.chauhraj.kdbtick.datatypes.Month;
import com.chauhraj.kdbtick.datatypes.Nulls;
import com.chauhraj.kdbtick.datatypes.Second;
import com.chauhraj.kdbtick.datatypes.Timespan;

/**
 * Writes values in kdb+ IPC form.
 * <p>
 * {@link #sizeOf(Object)} predicts the encoded length exactly, so callers allocate the message once and
 * {@link #write(IpcBuffer, Object)} never grows it. Types newer than the negotiated protocol version are
 * rejected: guid needs version 3, timestamp and timespan need version 1.
 * </p>
 */
public class Serializer {

  private final int ipcVersion;

  /**
   * @param ipcVersion negotiated protocol version, 0 to 3
   */
  public Serializer(int ipcVersion) {
    this.ipcVersion = ipcVersion;
  }

  /**
   * Calculates the number of bytes needed to serialize the supplied object.
   * @param x object to be serialized
   * @return number of bytes
   * @throws IllegalArgumentException if {@code x} cannot be serialized
   */
  public int sizeOf(Object x) {
    KType type = KType.of(x);
    Object v = unwrap(x);
    switch (type) {
      case BOOLEAN: case GUID: case BYTE: case SHORT: case INT: case LONG: case REAL: case FLOAT: case CHAR:
      case TIMESTAMP: case MONTH: case DATE: case DATETIME: case TIMESPAN: case MINUTE: case SECOND: case TIME:
        return 1 + type.size();
      case SYMBOL:
        return 2 + symbolLength((String) v);
      case LIST: {
        int size = 6;
        for (Object o : elements(v))
          size += sizeOf(o);
        return size;
      }
      case CHAR_VECTOR:
        return 6 + chars(v).length;
      case SYMBOL_VECTOR: {
        int size = 6;
        for (String s : (String[]) v)
          size += 1 + symbolLength(s);
        return size;
      }
      case BOOLEAN_VECTOR: case GUID_VECTOR: case BYTE_VECTOR: case SHORT_VECTOR: case INT_VECTOR: case LONG_VECTOR:
      case REAL_VECTOR: case FLOAT_VECTOR: case TIMESTAMP_VECTOR: case MONTH_VECTOR: case DATE_VECTOR:
      case DATETIME_VECTOR: case TIMESPAN_VECTOR: case MINUTE_VECTOR: case SECOND_VECTOR: case TIME_VECTOR:
        return 6 + Array.getLength(v) * type.size();
      case TABLE:
        return 3 + sizeOf(((Flip) v).x) + sizeOf(((Flip) v).y);
      case DICT: case SORTED_DICT:
        return 1 + sizeOf(((Dict) v).x) + sizeOf(((Dict) v).y);
      case UNARY_PRIMITIVE:
        if (v == null)
          return 2;
        throw unsupported(type);
      case LAMBDA: case BINARY_PRIMITIVE: case TERNARY_OPERATOR: case PROJECTION: case COMPOSITION: case EACH:
      case OVER: case SCAN: case EACH_PRIOR: case EACH_RIGHT: case EACH_LEFT: case DYNAMIC_LOAD: case ERROR:
      default:
        throw unsupported(type);
    }
  }

  /**
   * Write object to serialization buffer
   * @param out buffer to write to, positioned at the value
   * @param x object to serialize
   * @throws IllegalArgumentException if {@code x} cannot be serialized
   * @throws IpcProtocolException if {@code x} needs a newer protocol version
   */
  public void write(IpcBuffer out, Object x) {
    KType type = KType.of(x);
    Object v = unwrap(x);
    byte attribute = x instanceof Attributed ? ((Attributed) x).attribute.code() : 0;
    out.putByte((byte) type.code());
    switch (type) {
      case BOOLEAN:
        out.putByte((byte) ((Boolean) v ? 1 : 0));
        return;
      case GUID:
        checkVersion(3, "Guid not valid pre kdb+3.0");
        writeGuid(out, (UUID) v);
        return;
      case BYTE:
        out.putByte((Byte) v);
        return;
      case SHORT:
        out.putShort((Short) v);
        return;
      case INT:
        out.putInt((Integer) v);
        return;
      case LONG:
        out.putLong((Long) v);
        return;
      case REAL:
        out.putFloat((Float) v);
        return;
      case FLOAT:
        out.putDouble((Double) v);
        return;
      case CHAR:
        out.putByte(charByte((Character) v));
        return;
      case SYMBOL:
        writeSymbol(out, (String) v);
        return;
      case TIMESTAMP:
        checkVersion(1, "Timestamp not valid pre kdb+2.6");
        out.putLong(KTime.toNanos((Instant) v));
        return;
      case MONTH:
        out.putInt(((Month) v).i);
        return;
      case DATE:
        out.putInt(KTime.toDays((LocalDate) v));
        return;
      case DATETIME:
        out.putDouble(KTime.toDatetime((LocalDateTime) v));
        return;
      case TIMESPAN:
        checkVersion(1, "Timespan not valid pre kdb+2.6");
        out.putLong(((Timespan) v).j);
        return;
      case MINUTE:
        out.putInt(((Minute) v).i);
        return;
      case SECOND:
        out.putInt(((Second) v).i);
        return;
      case TIME:
        out.putInt(KTime.toMillis((LocalTime) v));
        return;
      case DICT: case SORTED_DICT:
        write(out, ((Dict) v).x);
        write(out, ((Dict) v).y);
        return;
      case TABLE:
        out.putByte(attribute);
        out.putByte((byte) KType.DICT.code());
        write(out, ((Flip) v).x);
        write(out, ((Flip) v).y);
        return;
      case LIST: {
        Object[] list = elements(v);
        out.putByte(attribute).putInt(list.length);
        for (Object o : list)
          write(out, o);
        return;
      }
      case CHAR_VECTOR: {
        byte[] b = chars(v);
        out.putByte(attribute).putInt(b.length).putBytes(b);
        return;
      }
      case UNARY_PRIMITIVE:
        if (v == null) {
          out.putByte((byte) 0);
          return;
        }
        throw unsupported(type);
      case LAMBDA: case BINARY_PRIMITIVE: case TERNARY_OPERATOR: case PROJECTION: case COMPOSITION: case EACH:
      case OVER: case SCAN: case EACH_PRIOR: case EACH_RIGHT: case EACH_LEFT: case DYNAMIC_LOAD: case ERROR:
        throw unsupported(type);
      default:
        out.putByte(attribute).putInt(Array.getLength(v));
        writeVector(out, type, v);
    }
  }

  private void writeVector(IpcBuffer out, KType type, Object v) {
    switch (type) {
      case BOOLEAN_VECTOR:
        for (boolean b : (boolean[]) v)
          out.putByte((byte) (b ? 1 : 0));
        break;
      case GUID_VECTOR:
        checkVersion(3, "Guid not valid pre kdb+3.0");
        for (UUID g : (UUID[]) v)
          writeGuid(out, g);
        break;
      case BYTE_VECTOR:
        out.putBytes((byte[]) v);
        break;
      case SHORT_VECTOR:
        for (short h : (short[]) v)
          out.putShort(h);
        break;
      case INT_VECTOR:
        for (int i : (int[]) v)
          out.putInt(i);
        break;
      case LONG_VECTOR:
        for (long j : (long[]) v)
          out.putLong(j);
        break;
      case REAL_VECTOR:
        for (float e : (float[]) v)
          out.putFloat(e);
        break;
      case FLOAT_VECTOR:
        for (double f : (double[]) v)
          out.putDouble(f);
        break;
      case SYMBOL_VECTOR:
        for (String s : (String[]) v)
          writeSymbol(out, s);
        break;
      case TIMESTAMP_VECTOR:
        checkVersion(1, "Timestamp not valid pre kdb+2.6");
        for (Instant p : (Instant[]) v)
          out.putLong(KTime.toNanos(p));
        break;
      case MONTH_VECTOR:
        for (Month m : (Month[]) v)
          out.putInt(m == null ? Nulls.NULL_INT : m.i);
        break;
      case DATE_VECTOR:
        for (LocalDate d : (LocalDate[]) v)
          out.putInt(KTime.toDays(d));
        break;
      case DATETIME_VECTOR:
        for (LocalDateTime z : (LocalDateTime[]) v)
          out.putDouble(KTime.toDatetime(z));
        break;
      case TIMESPAN_VECTOR:
        checkVersion(1, "Timespan not valid pre kdb+2.6");
        for (Timespan n : (Timespan[]) v)
          out.putLong(n == null ? Nulls.NULL_LONG : n.j);
        break;
      case MINUTE_VECTOR:
        for (Minute u : (Minute[]) v)
          out.putInt(u == null ? Nulls.NULL_INT : u.i);
        break;
      case SECOND_VECTOR:
        for (Second s : (Second[]) v)
          out.putInt(s == null ? Nulls.NULL_INT : s.i);
        break;
      case TIME_VECTOR:
        for (LocalTime t : (LocalTime[]) v)
          out.putInt(KTime.toMillis(t));
        break;
      default:
        throw new IllegalStateException("Not a fixed-width vector: " + type);
    }
  }

  private void checkVersion(int required, String message) {
    if (ipcVersion < required)
      throw new IpcProtocolException(message);
  }

  private static void writeGuid(IpcBuffer out, UUID g) {
    UUID uuid = g == null ? new UUID(0, 0) : g;
    out.putLong(uuid.getMostSignificantBits());
    out.putLong(uuid.getLeastSignificantBits());
  }

  private static void writeSymbol(IpcBuffer out, String s) {
    int n = symbolLength(s);
    for (int i = 0; i < n; i++)
      out.putByte((byte) s.charAt(i));
    out.putByte((byte) 0);
  }

  /**
   * Number of bytes a symbol occupies, excluding its terminator. A {@code null} symbol is the empty symbol.
   * @throws IllegalArgumentException if the symbol has an embedded NUL or a char outside ISO-8859-1
   */
  static int symbolLength(String s) {
    if (s == null)
      return 0;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == 0)
        throw new IllegalArgumentException("Symbol contains an embedded NUL: " + s);
      if (c > 0xff)
        throw new IllegalArgumentException("Symbol is not ISO-8859-1: " + s);
    }
    return s.length();
  }

  private static byte charByte(char c) {
    if (c > 0xff)
      throw new IllegalArgumentException("Char is not ISO-8859-1: " + c);
    return (byte) c;
  }

  private static byte[] chars(Object v) {
    CharSequence cs = v instanceof char[] ? new String((char[]) v) : (CharVector) v;
    byte[] b = new byte[cs.length()];
    for (int i = 0; i < b.length; i++)
      b[i] = charByte(cs.charAt(i));
    return b;
  }

  private static Object[] elements(Object v) {
    if (v instanceof Object[])
      return (Object[]) v;
    if (v instanceof List)
      return ((List<?>) v).toArray();
    throw new IllegalArgumentException("Cannot serialize " + v.getClass().getName());
  }

  private static Object unwrap(Object x) {
    return x instanceof Attributed ? ((Attributed) x).value : x;
  }

  private static IllegalArgumentException unsupported(KType type) {
    return new IllegalArgumentException("Cannot serialize a value of type " + type);
  }
}
