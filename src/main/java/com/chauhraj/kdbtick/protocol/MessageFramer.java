package com.chauhraj.kdbtick.protocol;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;

import com.chauhraj.kdbtick.datatypes.KType;

/**
 * Wraps serialized values in the 8-byte IPC header and unwraps received messages.
 * <p>
 * Header layout: byte 0 endianness (1 = little), byte 1 {@link MessageType}, byte 2 compression flag,
 * byte 3 reserved, bytes 4 to 7 total length including the header, in the message's own endianness.
 * Outbound messages are always big-endian.
 * </p>
 */
public class MessageFramer {

  public static final int HEADER_SIZE = 8;

  static final int ENDIAN_OFFSET = 0;
  static final int MSG_TYPE_OFFSET = 1;
  static final int COMPRESSION_OFFSET = 2;
  static final int MSG_LENGTH_OFFSET = 4;

  private static final byte BIG_ENDIAN = 0;
  private static final byte LITTLE_ENDIAN = 1;

  private final Serializer serializer;
  private final Deserializer deserializer = new Deserializer();

  /**
   * @param ipcVersion negotiated protocol version, used to gate the types that may be written
   */
  public MessageFramer(int ipcVersion) {
    this.serializer = new Serializer(ipcVersion);
  }

  /**
   * Serialises {@code x} as a complete message.
   * @param type kind of the message
   * @param x object to serialise
   * @param compress true to attempt compression; it is applied only above {@link Compression#THRESHOLD}
   * bytes and only when it pays off
   * @return the framed message
   * @throws IllegalArgumentException if {@code x} cannot be serialized
   * @throws IpcProtocolException if {@code x} needs a newer protocol version
   */
  public byte[] frame(MessageType type, Object x, boolean compress) {
    int length = HEADER_SIZE + serializer.sizeOf(x);
    IpcBuffer out = IpcBuffer.allocate(length);
    writeHeader(out, type, length);
    serializer.write(out, x);
    byte[] message = out.array();
    if (compress && length > Compression.THRESHOLD)
      return Compression.compress(message, length);
    return message;
  }

  /**
   * Frames an error response carrying {@code text}.
   * @param text the error text, ISO-8859-1 without NUL
   * @return the framed response
   */
  public byte[] frameError(String text) {
    int length = HEADER_SIZE + 2 + Serializer.symbolLength(text);
    IpcBuffer out = IpcBuffer.allocate(length);
    writeHeader(out, MessageType.RESPONSE, length);
    out.putByte((byte) KType.ERROR.code());
    for (int i = 0; i < length - HEADER_SIZE - 2; i++)
      out.putByte((byte) text.charAt(i));
    out.putByte((byte) 0);
    return out.array();
  }

  /**
   * Reads exactly one message: the header, then as many bytes as it declares.
   * @param in stream to read from
   * @return the complete message, header included
   * @throws java.io.EOFException if the stream ends first
   * @throws IOException on a transport failure
   * @throws IpcProtocolException if the declared length is shorter than a header
   */
  public static byte[] readFrame(InputStream in) throws IOException {
    DataInputStream data = in instanceof DataInputStream ? (DataInputStream) in : new DataInputStream(in);
    byte[] header = new byte[HEADER_SIZE];
    data.readFully(header);
    int length = Compression.getInt(header, MSG_LENGTH_OFFSET, header[ENDIAN_OFFSET] == LITTLE_ENDIAN);
    if (length < HEADER_SIZE)
      throw new IpcProtocolException("Invalid message length: " + length);
    byte[] message = new byte[length];
    System.arraycopy(header, 0, message, 0, HEADER_SIZE);
    data.readFully(message, HEADER_SIZE, length - HEADER_SIZE);
    return message;
  }

  /**
   * Deserialises a received message.
   * @param message the complete message, header included
   * @return kind and deserialised body
   * @throws KException if the message carries a kdb+ error
   * @throws IpcProtocolException if the message is malformed
   */
  public Message decode(byte[] message) throws KException {
    byte[] plain = Compression.decompress(message);
    if (plain.length <= HEADER_SIZE)
      throw new IpcProtocolException("Message has no body");
    MessageType type = MessageType.fromCode(plain[MSG_TYPE_OFFSET]);
    IpcBuffer in = IpcBuffer.wrap(plain).littleEndian(plain[ENDIAN_OFFSET] == LITTLE_ENDIAN);
    in.position(HEADER_SIZE);
    if (plain[HEADER_SIZE] == (byte) KType.ERROR.code()) {
      in.position(HEADER_SIZE + 1);
      throw new KException(in.getSymbol());
    }
    return new Message(type, deserializer.read(in));
  }

  private static void writeHeader(IpcBuffer out, MessageType type, int length) {
    out.putByte(BIG_ENDIAN);
    out.putByte(type.code());
    out.putByte((byte) 0);
    out.putByte((byte) 0);
    out.putInt(length);
  }
}
