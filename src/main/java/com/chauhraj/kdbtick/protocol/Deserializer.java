package com.chauhraj.kdbtick.protocol;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.UUID;

import com.chauhraj.kdbtick.datatypes.Attribute;
import com.chauhraj.kdbtick.datatypes.Attributed;
import com.chauhraj.kdbtick.datatypes.CharVector;
import com.chauhraj.kdbtick.datatypes.Dict;
import com.chauhraj.kdbtick.datatypes.Flip;
import com.chauhraj.kdbtick.datatypes.Function;
import com.chauhraj.kdbtick.datatypes.KType;
import com.chauhraj.kdbtick.datatypes.Minute;
import com.chauhraj.kdbtick.datatypes.Month;
import com.chauhraj.kdbtick.datatypes.Second;
import com.chauhraj.kdbtick.datatypes.Timespan;

/**
 * Reads kdb+ IPC values from an {@link IpcBuffer}. Stateless; the buffer carries the cursor and the
 * endianness of the message.
 */
public class Deserializer {

  /**
   * Deserializes one value at the buffer's cursor, advancing past it.
   * @param in buffer positioned at a type byte
   * @return deserialised object
   * @throws IpcProtocolException on an unknown type code or attribute, or a truncated value
   */
  public Object read(IpcBuffer in) {
    int code = in.getByte();
    KType type = KType.fromCode(code);
    if (type == null)
      throw new IpcProtocolException("Unknown type code: " + code);
    switch (type) {
      case BOOLEAN:
        return in.getByte() != 0;
      case GUID:
        return readGuid(in);
      case BYTE:
        return in.getByte();
      case SHORT:
        return in.getShort();
      case INT:
        return in.getInt();
      case LONG:
        return in.getLong();
      case REAL:
        return in.getFloat();
      case FLOAT:
        return in.getDouble();
      case CHAR:
        return (char) (in.getByte() & 0xff);
      case SYMBOL:
        return in.getSymbol();
      case TIMESTAMP:
        return KTime.fromNanos(in.getLong());
      case MONTH:
        return new Month(in.getInt());
      case DATE:
        return KTime.fromDays(in.getInt());
      case DATETIME:
        return KTime.fromDatetime(in.getDouble());
      case TIMESPAN:
        return new Timespan(in.getLong());
      case MINUTE:
        return new Minute(in.getInt());
      case SECOND:
        return new Second(in.getInt());
      case TIME:
        return KTime.fromMillis(in.getInt());
      case DICT:
        return new Dict(read(in), read(in));
      case SORTED_DICT:
        return new Attributed(Attribute.SORTED, new Dict(read(in), read(in)));
      case TABLE: {
        Attribute attribute = readAttribute(in);
        Object dict = read(in);
        if (!(dict instanceof Dict))
          throw new IpcProtocolException("Table body is not a dictionary");
        try {
          return attributed(attribute, new Flip((Dict) dict));
        } catch (IllegalArgumentException e) {
          throw new IpcProtocolException("Malformed table: " + e.getMessage(), e);
        }
      }
      case LAMBDA:
        in.getSymbol();
        return new Function(type, String.valueOf(read(in)));
      case UNARY_PRIMITIVE:
        return in.getByte() == 0 ? null : new Function(type);
      case BINARY_PRIMITIVE: case TERNARY_OPERATOR:
        in.getByte();
        return new Function(type);
      case PROJECTION: case COMPOSITION:
        for (int i = 0, n = in.getInt(); i < n; i++)
          read(in);
        return new Function(type);
      case EACH: case OVER: case SCAN: case EACH_PRIOR: case EACH_RIGHT: case EACH_LEFT: case DYNAMIC_LOAD:
        read(in);
        return new Function(type);
      case ERROR:
        throw new IpcProtocolException("Error marker inside a message body");
      default: {
        Attribute attribute = readAttribute(in);
        int n = in.getInt();
        if (n < 0)
          throw new IpcProtocolException("Negative vector length: " + n);
        // every element takes at least one byte, lists and symbols included
        if ((long) n * Math.max(1, type.size()) > in.remaining())
          throw new IpcProtocolException("Vector length exceeds message: " + n);
        return attributed(attribute, readVector(in, type, n));
      }
    }
  }

  private Object readVector(IpcBuffer in, KType type, int n) {
    int i = 0;
    switch (type) {
      case LIST: {
        Object[] objArr = new Object[n];
        for (; i < n; i++)
          objArr[i] = read(in);
        return objArr;
      }
      case BOOLEAN_VECTOR: {
        boolean[] boolArr = new boolean[n];
        for (; i < n; i++)
          boolArr[i] = in.getByte() != 0;
        return boolArr;
      }
      case GUID_VECTOR: {
        UUID[] uuidArr = new UUID[n];
        for (; i < n; i++)
          uuidArr[i] = readGuid(in);
        return uuidArr;
      }
      case BYTE_VECTOR: {
        byte[] byteArr = new byte[n];
        in.getBytes(byteArr);
        return byteArr;
      }
      case SHORT_VECTOR: {
        short[] shortArr = new short[n];
        for (; i < n; i++)
          shortArr[i] = in.getShort();
        return shortArr;
      }
      case INT_VECTOR: {
        int[] intArr = new int[n];
        for (; i < n; i++)
          intArr[i] = in.getInt();
        return intArr;
      }
      case LONG_VECTOR: {
        long[] longArr = new long[n];
        for (; i < n; i++)
          longArr[i] = in.getLong();
        return longArr;
      }
      case REAL_VECTOR: {
        float[] floatArr = new float[n];
        for (; i < n; i++)
          floatArr[i] = in.getFloat();
        return floatArr;
      }
      case FLOAT_VECTOR: {
        double[] doubleArr = new double[n];
        for (; i < n; i++)
          doubleArr[i] = in.getDouble();
        return doubleArr;
      }
      case CHAR_VECTOR: {
        char[] charArr = new char[n];
        for (; i < n; i++)
          charArr[i] = (char) (in.getByte() & 0xff);
        return new CharVector(charArr);
      }
      case SYMBOL_VECTOR: {
        String[] symArr = new String[n];
        for (; i < n; i++)
          symArr[i] = in.getSymbol();
        return symArr;
      }
      case TIMESTAMP_VECTOR: {
        Instant[] timestampArr = new Instant[n];
        for (; i < n; i++)
          timestampArr[i] = KTime.fromNanos(in.getLong());
        return timestampArr;
      }
      case MONTH_VECTOR: {
        Month[] monthArr = new Month[n];
        for (; i < n; i++)
          monthArr[i] = new Month(in.getInt());
        return monthArr;
      }
      case DATE_VECTOR: {
        LocalDate[] dateArr = new LocalDate[n];
        for (; i < n; i++)
          dateArr[i] = KTime.fromDays(in.getInt());
        return dateArr;
      }
      case DATETIME_VECTOR: {
        LocalDateTime[] datetimeArr = new LocalDateTime[n];
        for (; i < n; i++)
          datetimeArr[i] = KTime.fromDatetime(in.getDouble());
        return datetimeArr;
      }
      case TIMESPAN_VECTOR: {
        Timespan[] timespanArr = new Timespan[n];
        for (; i < n; i++)
          timespanArr[i] = new Timespan(in.getLong());
        return timespanArr;
      }
      case MINUTE_VECTOR: {
        Minute[] minuteArr = new Minute[n];
        for (; i < n; i++)
          minuteArr[i] = new Minute(in.getInt());
        return minuteArr;
      }
      case SECOND_VECTOR: {
        Second[] secondArr = new Second[n];
        for (; i < n; i++)
          secondArr[i] = new Second(in.getInt());
        return secondArr;
      }
      case TIME_VECTOR: {
        LocalTime[] timeArr = new LocalTime[n];
        for (; i < n; i++)
          timeArr[i] = KTime.fromMillis(in.getInt());
        return timeArr;
      }
      default:
        throw new IpcProtocolException("Unknown type code: " + type.code());
    }
  }

  // guids are big-endian whatever the message says
  private static UUID readGuid(IpcBuffer in) {
    boolean littleEndian = in.littleEndian();
    in.littleEndian(false);
    try {
      return new UUID(in.getLong(), in.getLong());
    } finally {
      in.littleEndian(littleEndian);
    }
  }

  private static Attribute readAttribute(IpcBuffer in) {
    byte code = in.getByte();
    try {
      return Attribute.fromCode(code);
    } catch (IllegalArgumentException e) {
      throw new IpcProtocolException("Unknown attribute: " + code, e);
    }
  }

  private static Object attributed(Attribute attribute, Object value) {
    return attribute == Attribute.NONE ? value : new Attributed(attribute, value);
  }
}
