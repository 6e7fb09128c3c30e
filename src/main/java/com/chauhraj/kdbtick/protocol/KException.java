package com.chauhraj.kdbtick.protocol;

/**
 * An error returned by the remote kdb+ process, e.g. {@code 'type} or {@code 'length}.
 * The connection stays usable after a remote error.
 */
public class KException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * @param s the error text sent by the remote process
   */
  public KException(String s) {
    super(s);
  }
}
