package com.chauhraj.kdbtick.protocol;

/**
 * Message kind, byte 1 of the IPC header.
 */
public enum MessageType {
  /** Fire-and-forget; no response is sent. */
  ASYNC(0),
  /** Request; the receiver must answer with a {@link #RESPONSE}. */
  SYNC(1),
  RESPONSE(2);

  private final byte code;

  MessageType(int code) {
    this.code = (byte) code;
  }

  public byte code() {
    return code;
  }

  public static MessageType fromCode(byte code) {
    switch (code) {
      case 0: return ASYNC;
      case 1: return SYNC;
      case 2: return RESPONSE;
      default:
        throw new IpcProtocolException("Invalid message type received: " + code);
    }
  }
}
