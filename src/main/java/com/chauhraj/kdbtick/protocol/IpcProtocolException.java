package com.chauhraj.kdbtick.protocol;

/**
 * A violation of the IPC protocol: a malformed inbound message, a type the negotiated protocol version
 * cannot carry, or a response sent with no request outstanding. Never retried.
 */
public class IpcProtocolException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public IpcProtocolException(String message) {
    super(message);
  }

  public IpcProtocolException(String message, Throwable cause) {
    super(message, cause);
  }
}
