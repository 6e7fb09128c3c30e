package com.chauhraj.kdbtick.protocol;

import java.io.IOException;

/**
 * The remote process rejected the credentials, or closed the connection before sending its protocol version.
 */
public class HandshakeException extends IOException {
  private static final long serialVersionUID = 1L;

  public HandshakeException(String message) {
    super(message);
  }
}
