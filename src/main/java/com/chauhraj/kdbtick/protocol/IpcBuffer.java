package com.chauhraj.kdbtick.protocol;

import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import org.agrona.ExpandableArrayBuffer;
import org.agrona.MutableDirectBuffer;
import org.agrona.concurrent.UnsafeBuffer;

/**
 * A byte buffer with a read/write cursor, owned by one codec call at a time.
 * <p>
 * Reads honour the endianness of the message being read ({@link #littleEndian(boolean)}, taken from header
 * byte 0) and build wider values from narrower ones: two bytes make a short, two shorts an int, two ints a long.
 * Writes are always big-endian whatever the flag says. Outbound headers declare big-endian and every kdb+
 * peer accepts it, so the asymmetry is part of the wire contract and must stay.
 * </p>
 */
public final class IpcBuffer {
  private final MutableDirectBuffer buffer;
  private final int limit;
  private int position;
  private boolean littleEndian;

  private IpcBuffer(MutableDirectBuffer buffer, int limit) {
    this.buffer = buffer;
    this.limit = limit;
  }

  /** Wraps received bytes for reading. */
  public static IpcBuffer wrap(byte[] bytes) {
    return new IpcBuffer(new UnsafeBuffer(bytes), bytes.length);
  }

  /** An exact-size buffer for writing; writing past {@code capacity} fails. */
  public static IpcBuffer allocate(int capacity) {
    return new IpcBuffer(new UnsafeBuffer(new byte[capacity]), capacity);
  }

  /** A buffer that grows as it is written. */
  public static IpcBuffer growable() {
    return new IpcBuffer(new ExpandableArrayBuffer(), Integer.MAX_VALUE);
  }

  public int position() {
    return position;
  }

  public IpcBuffer position(int position) {
    this.position = position;
    return this;
  }

  /** Bytes left to read before the limit. */
  public int remaining() {
    return limit - position;
  }

  public boolean littleEndian() {
    return littleEndian;
  }

  public IpcBuffer littleEndian(boolean littleEndian) {
    this.littleEndian = littleEndian;
    return this;
  }

  /** The backing array; for an allocated buffer this is the whole message. */
  public byte[] array() {
    return buffer.byteArray();
  }

  /** Copy of the bytes from 0 up to the cursor. */
  public byte[] toByteArray() {
    byte[] bytes = new byte[position];
    buffer.getBytes(0, bytes);
    return bytes;
  }

  public byte getByte() {
    if (position >= limit)
      throw new IpcProtocolException("Message truncated at byte " + position);
    return buffer.getByte(position++);
  }

  public short getShort() {
    int x = getByte() & 0xff;
    int y = getByte() & 0xff;
    return (short) (littleEndian ? x | y << 8 : x << 8 | y);
  }

  public int getInt() {
    int x = getShort() & 0xffff;
    int y = getShort() & 0xffff;
    return littleEndian ? x | y << 16 : x << 16 | y;
  }

  public long getLong() {
    long x = getInt() & 0xffffffffL;
    long y = getInt() & 0xffffffffL;
    return littleEndian ? x | y << 32 : x << 32 | y;
  }

  public float getFloat() {
    return Float.intBitsToFloat(getInt());
  }

  public double getDouble() {
    return Double.longBitsToDouble(getLong());
  }

  public void getBytes(byte[] dst) {
    if (position + dst.length > limit)
      throw new IpcProtocolException("Message truncated at byte " + position);
    buffer.getBytes(position, dst);
    position += dst.length;
  }

  /** Reads a NUL-terminated ISO-8859-1 symbol. */
  public String getSymbol() {
    int start = position;
    while (getByte() != 0) {
      // scan to the terminator
    }
    int len = position - 1 - start;
    if (len == 0)
      return "";
    byte[] bytes = new byte[len];
    buffer.getBytes(start, bytes);
    return new String(bytes, StandardCharsets.ISO_8859_1);
  }

  public IpcBuffer putByte(byte b) {
    buffer.putByte(position, b);
    position += 1;
    return this;
  }

  public IpcBuffer putShort(short h) {
    buffer.putShort(position, h, ByteOrder.BIG_ENDIAN);
    position += 2;
    return this;
  }

  public IpcBuffer putInt(int i) {
    buffer.putInt(position, i, ByteOrder.BIG_ENDIAN);
    position += 4;
    return this;
  }

  public IpcBuffer putLong(long j) {
    buffer.putLong(position, j, ByteOrder.BIG_ENDIAN);
    position += 8;
    return this;
  }

  public IpcBuffer putFloat(float e) {
    return putInt(Float.floatToRawIntBits(e));
  }

  public IpcBuffer putDouble(double f) {
    return putLong(Double.doubleToRawLongBits(f));
  }

  public IpcBuffer putBytes(byte[] src) {
    buffer.putBytes(position, src);
    position += src.length;
    return this;
  }
}
