package com.chauhraj.kdbtick.protocol;

import java.util.Arrays;

/**
 * kdb+ IPC message compression.
 * <p>
 * The body is an LZ-style stream: a control byte precedes every group of eight tokens, one bit per token.
 * A clear bit is a literal byte. A set bit is a back reference of two bytes, a hash of the pair being
 * matched followed by the count of further bytes to copy. Both sides keep a 256-entry table mapping the
 * xor of two adjacent bytes to the last position it was seen, so no offsets travel on the wire.
 * </p>
 * <p>
 * A compressed message keeps the original header with byte 2 set to 1 and bytes 4 to 7 holding the
 * compressed length. Bytes 8 to 11 hold the uncompressed length and the stream starts at byte 12.
 * </p>
 */
public final class Compression {

  /** Messages no longer than this are never compressed. */
  public static final int THRESHOLD = 2000;

  private static final int HEADER_SIZE = 8;

  private Compression() {
  }

  /**
   * Compresses a whole framed message.
   * @see #compress(byte[], int)
   */
  public static byte[] compress(byte[] message) {
    return compress(message, message.length);
  }

  /**
   * Compresses the first {@code length} bytes of a framed message.
   * @param message an uncompressed message, header included
   * @param length number of bytes of {@code message} in use
   * @return the compressed message, or {@code message} itself when compressing would not save at least half
   */
  public static byte[] compress(byte[] message, int length) {
    byte[] y = message;
    int t = length;
    if (t <= HEADER_SIZE)
      return message;
    boolean littleEndian = y[0] == 1;
    byte[] out = new byte[y.length / 2];
    int e = out.length;
    if (e < 12)
      return message;
    System.arraycopy(y, 0, out, 0, 4);
    out[2] = 1;
    putInt(out, 8, t, littleEndian);

    int[] a = new int[256];
    int i = 0;
    int f = 0;
    int h = 0;
    int h0 = 0;
    int p;
    int s0 = 0;
    int s = HEADER_SIZE;
    int c = 12;
    int d = c;
    while (s < t) {
      if (i == 0) {
        if (d > e - 17)
          return message;
        i = 1;
        out[c] = (byte) f;
        c = d++;
        f = 0;
      }
      boolean literal = s > t - 3;
      p = 0;
      if (!literal) {
        h = 0xff & (y[s] ^ y[s + 1]);
        p = a[h];
        literal = p == 0 || y[s] != y[p];
      }
      if (s0 > 0) {
        a[h0] = s0;
        s0 = 0;
      }
      if (literal) {
        h0 = h;
        s0 = s;
        out[d++] = y[s++];
      } else {
        a[h] = s;
        f |= i;
        p += 2;
        int r = s += 2;
        int q = Math.min(s + 255, t);
        while (s < q && y[p] == y[s]) {
          ++p;
          ++s;
        }
        out[d++] = (byte) h;
        out[d++] = (byte) (s - r);
      }
      i *= 2;
      if (i == 256)
        i = 0;
    }
    out[c] = (byte) f;
    putInt(out, 4, d, littleEndian);
    return Arrays.copyOf(out, d);
  }

  /**
   * Restores a message compressed by kdb+ or by {@link #compress(byte[], int)}.
   * @param message a framed message
   * @return the uncompressed message with byte 2 cleared and the length field updated, or {@code message}
   * itself when it is not compressed
   * @throws IpcProtocolException when the compressed flag is unknown or the stream is malformed
   */
  public static byte[] decompress(byte[] message) {
    if (message.length < HEADER_SIZE)
      throw new IpcProtocolException("Message shorter than its header: " + message.length);
    if (message[2] == 0)
      return message;
    if (message[2] != 1)
      throw new IpcProtocolException("Unknown compression flag: " + message[2]);
    if (message.length < 12)
      throw malformed();
    boolean littleEndian = message[0] == 1;
    int size = getInt(message, 8, littleEndian);
    if (size < HEADER_SIZE)
      throw malformed();

    byte[] src = message;
    byte[] dst = new byte[size];
    int[] aa = new int[256];
    int n = 0;
    int f = 0;
    int i = 0;
    int s = HEADER_SIZE;
    int p = s;
    int d = 12;
    while (s < dst.length) {
      if (i == 0) {
        if (d >= src.length)
          throw malformed();
        f = 0xff & src[d++];
        i = 1;
      }
      boolean match = (f & i) != 0;
      if (match) {
        if (d + 1 >= src.length)
          throw malformed();
        int r = aa[0xff & src[d++]];
        n = 0xff & src[d++];
        if (s + 2 + n > dst.length)
          throw malformed();
        dst[s++] = dst[r++];
        dst[s++] = dst[r++];
        // source and target may overlap, copy one byte at a time
        for (int m = 0; m < n; m++)
          dst[s + m] = dst[r + m];
      } else {
        if (d >= src.length)
          throw malformed();
        dst[s++] = src[d++];
      }
      while (p < s - 1) {
        aa[(0xff & dst[p]) ^ (0xff & dst[p + 1])] = p;
        p++;
      }
      if (match)
        p = s += n;
      i *= 2;
      if (i == 256)
        i = 0;
    }
    System.arraycopy(message, 0, dst, 0, 4);
    dst[2] = 0;
    putInt(dst, 4, size, littleEndian);
    return dst;
  }

  private static IpcProtocolException malformed() {
    return new IpcProtocolException("malformed compressed message");
  }

  static void putInt(byte[] b, int offset, int v, boolean littleEndian) {
    for (int k = 0; k < 4; k++)
      b[offset + (littleEndian ? k : 3 - k)] = (byte) (v >>> (8 * k));
  }

  static int getInt(byte[] b, int offset, boolean littleEndian) {
    int v = 0;
    for (int k = 0; k < 4; k++)
      v |= (0xff & b[offset + (littleEndian ? k : 3 - k)]) << (8 * k);
    return v;
  }
}
