package com.chauhraj.kdbtick;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chauhraj.kdbtick.datatypes.CharVector;
import com.chauhraj.kdbtick.protocol.HandshakeException;
import com.chauhraj.kdbtick.protocol.IpcProtocolException;
import com.chauhraj.kdbtick.protocol.KException;
import com.chauhraj.kdbtick.protocol.Message;
import com.chauhraj.kdbtick.protocol.MessageFramer;
import com.chauhraj.kdbtick.protocol.MessageType;

/**
 * A blocking connection to one kdb+ process.
 * <p>
 * Every call runs on the caller's thread; there is no background reader. {@link #sendSync(Object)} blocks until
 * the response arrives or the socket fails, bounded only by the timeout given at connect time. Closing the
 * connection from another thread is the only way to abandon a blocked call.
 * </p>
 * <p>
 * <b>Not thread-safe.</b> A connection carries one request at a time and takes no locks. Callers that need
 * concurrent requests must use one connection each or serialize access themselves.
 * </p>
 * <p>
 * A transport or protocol failure closes the connection before the exception reaches the caller; call
 * {@link #connect(String, int, String, boolean, int)} again to reuse it. A {@link KException} from the remote
 * process leaves the connection open.
 * </p>
 */
public class Connection implements Closeable {
  private static final Logger logger = LoggerFactory.getLogger(Connection.class);

  /** Highest protocol version this client speaks. */
  public static final int MAX_IPC_VERSION = 3;

  public enum State {
    DISCONNECTED,
    CONNECTING,
    HANDSHAKING,
    READY
  }

  /**
   * Handles a message that is not the awaited response: an async notification pushed by the peer, or a
   * sync request from it. A sync request must be answered with {@link Connection#sendResponse(Object)} or
   * {@link Connection#sendError(String)}.
   */
  @FunctionalInterface
  public interface MessageHandler {
    void process(Connection connection, Message message) throws IOException;
  }

  /** Drops async messages and refuses sync requests so the peer is not left waiting. */
  public static final MessageHandler DEFAULT_HANDLER = (connection, message) -> {
    if (message.type() == MessageType.SYNC) {
      connection.sendError("unable to process sync requests");
    } else {
      logger.debug("Discarding async message while awaiting response: {}", message.value());
    }
  };

  private Socket socket;
  private DataInputStream inStream;
  private OutputStream outStream;
  private MessageFramer framer;
  private MessageHandler messageHandler = DEFAULT_HANDLER;
  private volatile State state = State.DISCONNECTED;
  private int ipcVersion;
  private boolean loopback;
  private boolean compressionEnabled;
  private int pending;

  /** Creates a disconnected instance; call {@link #connect(String, int, String, boolean, int)} to use it. */
  public Connection() {
  }

  /**
   * Connects over plain TCP with no timeout.
   * @see #connect(String, int, String, boolean, int)
   */
  public Connection(String host, int port, String credentials) throws IOException {
    this(host, port, credentials, false, 0);
  }

  /**
   * Connects and completes the handshake.
   * @see #connect(String, int, String, boolean, int)
   */
  public Connection(String host, int port, String credentials, boolean useTls, int timeoutMillis) throws IOException {
    connect(host, port, credentials, useTls, timeoutMillis);
  }

  /**
   * Opens the socket and negotiates the protocol version.
   * @param host host name or address
   * @param port port number
   * @param credentials {@code user:password}, or an empty string
   * @param useTls wrap the socket in TLS using the JVM's default trust store
   * @param timeoutMillis connect and read timeout in milliseconds, 0 for none
   * @throws HandshakeException if the peer rejects the credentials
   * @throws IOException if the peer cannot be reached
   * @throws IllegalArgumentException if the credentials contain a NUL or a char outside ISO-8859-1
   * @throws IllegalStateException if this connection is already open
   */
  public void connect(String host, int port, String credentials, boolean useTls, int timeoutMillis) throws IOException {
    if (state != State.DISCONNECTED)
      throw new IllegalStateException("Connection is already " + state);
    byte[] user = credentialBytes(credentials == null ? "" : credentials);
    state = State.CONNECTING;
    try {
      Socket s = new Socket();
      socket = s;
      s.setTcpNoDelay(true);
      s.setKeepAlive(true);
      s.connect(new InetSocketAddress(host, port), timeoutMillis);
      s.setSoTimeout(timeoutMillis);
      InetAddress address = s.getInetAddress();
      loopback = address.isLoopbackAddress() || address.isAnyLocalAddress();
      if (useTls) {
        SSLSocket ssl = (SSLSocket) ((SSLSocketFactory) SSLSocketFactory.getDefault()).createSocket(s, host, port, true);
        ssl.startHandshake();
        socket = ssl;
      }
      inStream = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
      outStream = new BufferedOutputStream(socket.getOutputStream());
      state = State.HANDSHAKING;
      handshake(user);
      framer = new MessageFramer(ipcVersion);
      pending = 0;
      state = State.READY;
      logger.info("Connected to {}:{} (ipc version {}, tls {})", host, port, ipcVersion, useTls);
    } catch (IOException | RuntimeException e) {
      close();
      throw e;
    }
  }

  private static byte[] credentialBytes(String credentials) {
    for (int i = 0; i < credentials.length(); i++) {
      char c = credentials.charAt(i);
      if (c == 0 || c > 0xff)
        throw new IllegalArgumentException("Credentials must be ISO-8859-1 without NUL");
    }
    return credentials.getBytes(StandardCharsets.ISO_8859_1);
  }

  private void handshake(byte[] user) throws IOException {
    byte[] hello = new byte[user.length + 2];
    System.arraycopy(user, 0, hello, 0, user.length);
    hello[user.length] = MAX_IPC_VERSION;
    outStream.write(hello);
    outStream.flush();
    int version = inStream.read();
    if (version < 0)
      throw new HandshakeException("access");
    ipcVersion = Math.min(MAX_IPC_VERSION, version);
    logger.debug("Peer offered ipc version {}, using {}", version, ipcVersion);
  }

  /**
   * Sends a value without waiting for a reply.
   * @param x value to send
   * @throws IOException on a transport failure; the connection is closed
   */
  public void sendAsync(Object x) throws IOException {
    write(frame(MessageType.ASYNC, x));
  }

  /** Sends a q expression to be evaluated remotely, without waiting for a reply. */
  public void sendAsync(String expr) throws IOException {
    sendAsync((Object) new CharVector(expr));
  }

  /** Calls a remote function with one argument, without waiting for a reply. */
  public void sendAsync(String fn, Object x) throws IOException {
    sendAsync((Object) new Object[] {new CharVector(fn), x});
  }

  public void sendAsync(String fn, Object x, Object y) throws IOException {
    sendAsync((Object) new Object[] {new CharVector(fn), x, y});
  }

  public void sendAsync(String fn, Object x, Object y, Object z) throws IOException {
    sendAsync((Object) new Object[] {new CharVector(fn), x, y, z});
  }

  /**
   * Sends a value and waits for the response. Async messages that arrive first go to the
   * {@link MessageHandler}, as do sync requests from the peer.
   * @param x value to send; a {@link String} passed as {@code Object} is sent as a symbol
   * @return the response value
   * @throws KException if the remote process returns an error
   * @throws IOException on a transport failure; the connection is closed
   */
  public Object sendSync(Object x) throws KException, IOException {
    write(frame(MessageType.SYNC, x));
    while (true) {
      Message message = receive();
      if (message.type() == MessageType.RESPONSE)
        return message.value();
      messageHandler.process(this, message);
    }
  }

  /** Evaluates a q expression remotely and returns its result. */
  public Object sendSync(String expr) throws KException, IOException {
    return sendSync((Object) new CharVector(expr));
  }

  /** Calls a remote function with one argument and returns its result. */
  public Object sendSync(String fn, Object x) throws KException, IOException {
    return sendSync((Object) new Object[] {new CharVector(fn), x});
  }

  public Object sendSync(String fn, Object x, Object y) throws KException, IOException {
    return sendSync((Object) new Object[] {new CharVector(fn), x, y});
  }

  public Object sendSync(String fn, Object x, Object y, Object z) throws KException, IOException {
    return sendSync((Object) new Object[] {new CharVector(fn), x, y, z});
  }

  /**
   * Reads the next message, e.g. an update published to a subscriber. A sync request must be answered
   * with {@link #sendResponse(Object)} or {@link #sendError(String)}.
   * @return the message
   * @throws KException if the message carries a remote error
   * @throws IOException on a transport failure; the connection is closed
   */
  public Message readMessage() throws KException, IOException {
    return receive();
  }

  /**
   * Answers the oldest unanswered sync request from the peer.
   * @param x the response value
   * @throws IpcProtocolException if there is no request to answer
   * @throws IOException on a transport failure; the connection is closed
   */
  public void sendResponse(Object x) throws IOException {
    if (pending == 0)
      throw new IpcProtocolException("Unexpected response msg");
    byte[] message = frame(MessageType.RESPONSE, x);
    pending--;
    write(message);
  }

  /**
   * Answers the oldest unanswered sync request from the peer with an error.
   * @param text the error text
   * @throws IpcProtocolException if there is no request to answer
   * @throws IOException on a transport failure; the connection is closed
   */
  public void sendError(String text) throws IOException {
    if (pending == 0)
      throw new IpcProtocolException("Unexpected error msg");
    ensureReady();
    byte[] message = framer.frameError(text);
    pending--;
    write(message);
  }

  /**
   * Probes the connection with a round trip. Never throws; a failed probe closes the connection.
   * @return true if the peer answered
   */
  public boolean isConnected() {
    if (state != State.READY)
      return false;
    try {
      sendSync("::");
      return true;
    } catch (KException e) {
      logger.debug("Probe returned remote error {}", e.getMessage());
      return true;
    } catch (IOException | RuntimeException e) {
      logger.debug("Probe failed", e);
      close();
      return false;
    }
  }

  public void setMessageHandler(MessageHandler messageHandler) {
    this.messageHandler = messageHandler == null ? DEFAULT_HANDLER : messageHandler;
  }

  /** Compresses large outbound messages; never applied to a loopback peer. */
  public void setCompressionEnabled(boolean compressionEnabled) {
    this.compressionEnabled = compressionEnabled;
  }

  public boolean isCompressionEnabled() {
    return compressionEnabled;
  }

  /** Negotiated protocol version, 0 to 3. */
  public int getIpcVersion() {
    return ipcVersion;
  }

  public boolean isLoopback() {
    return loopback;
  }

  public State getState() {
    return state;
  }

  /** Closes the socket. Safe to call more than once. */
  @Override
  public void close() {
    Socket s = socket;
    socket = null;
    inStream = null;
    outStream = null;
    framer = null;
    pending = 0;
    state = State.DISCONNECTED;
    if (s != null) {
      try {
        s.close();
        logger.info("Connection closed");
      } catch (IOException e) {
        logger.warn("Error while closing socket", e);
      }
    }
  }

  private byte[] frame(MessageType type, Object x) {
    ensureReady();
    return framer.frame(type, x, compressionEnabled && !loopback);
  }

  private Message receive() throws KException, IOException {
    ensureReady();
    try {
      Message message = framer.decode(MessageFramer.readFrame(inStream));
      if (message.type() == MessageType.SYNC)
        pending++;
      return message;
    } catch (IOException | IpcProtocolException e) {
      close();
      throw e;
    }
  }

  private void write(byte[] message) throws IOException {
    try {
      outStream.write(message);
      outStream.flush();
    } catch (IOException e) {
      close();
      throw e;
    }
  }

  private void ensureReady() {
    if (state != State.READY)
      throw new IllegalStateException("Connection is not open");
  }
}
