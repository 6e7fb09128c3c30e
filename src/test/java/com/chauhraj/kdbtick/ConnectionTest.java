package com.chauhraj.kdbtick;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import com.chauhraj.kdbtick.datatypes.CharVector;
import com.chauhraj.kdbtick.protocol.HandshakeException;
import com.chauhraj.kdbtick.protocol.IpcProtocolException;
import com.chauhraj.kdbtick.protocol.KException;
import com.chauhraj.kdbtick.protocol.Message;
import com.chauhraj.kdbtick.protocol.MessageType;

class ConnectionTest {

  @Test
  void negotiatesTheLowerProtocolVersion() throws Exception {
    AtomicReference<String> hello = new AtomicReference<>();
    try (FakeKdbServer server = new FakeKdbServer(peer -> hello.set(peer.handshake(5)));
         Connection connection = new Connection(server.host(), server.port(), "user:pass")) {
      server.await();
      assertThat(connection.getIpcVersion()).isEqualTo(3);
      assertThat(connection.getState()).isEqualTo(Connection.State.READY);
      assertThat(connection.isLoopback()).isTrue();
      assertThat(hello.get()).isEqualTo("user:pass\u0003");
    }
  }

  @Test
  void acceptsAnOlderPeer() throws Exception {
    try (FakeKdbServer server = new FakeKdbServer(peer -> peer.handshake(1));
         Connection connection = new Connection(server.host(), server.port(), "")) {
      server.await();
      assertThat(connection.getIpcVersion()).isEqualTo(1);
    }
  }

  @Test
  void rejectedCredentialsFailTheHandshake() throws Exception {
    try (FakeKdbServer server = new FakeKdbServer(FakeKdbServer.Peer::readHello)) {
      Connection connection = new Connection();
      assertThatThrownBy(() -> connection.connect(server.host(), server.port(), "bad:creds", false, 5000))
          .isInstanceOf(HandshakeException.class)
          .hasMessage("access");
      assertThat(connection.getState()).isEqualTo(Connection.State.DISCONNECTED);
      server.await();
    }
  }

  @Test
  void credentialsOutsideLatin1AreRejected() {
    Connection connection = new Connection();
    assertThatThrownBy(() -> connection.connect("127.0.0.1", 5010, "us\u20acr:pass", false, 1000))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("ISO-8859-1");
    assertThat(connection.getState()).isEqualTo(Connection.State.DISCONNECTED);
  }

  @Test
  void syncCallSkipsAsyncMessages() throws Exception {
    try (FakeKdbServer server = new FakeKdbServer(peer -> {
      peer.handshake(3);
      Message request = peer.read();
      assertThat(request.type()).isEqualTo(MessageType.SYNC);
      assertThat(request.value()).isEqualTo(new CharVector("1+1"));
      peer.send(MessageType.ASYNC, "heartbeat");
      peer.send(MessageType.RESPONSE, 2L);
    }); Connection connection = new Connection(server.host(), server.port(), "")) {
      assertThat(connection.sendSync("1+1")).isEqualTo(2L);
      server.await();
    }
  }

  @Test
  void functionCallsSendTheNameAsACharVector() throws Exception {
    try (FakeKdbServer server = new FakeKdbServer(peer -> {
      peer.handshake(3);
      Message request = peer.read();
      assertThat(request.type()).isEqualTo(MessageType.ASYNC);
      assertThat((Object[]) request.value()).containsExactly(new CharVector(".u.upd"), "trade", new long[] {1});
    }); Connection connection = new Connection(server.host(), server.port(), "")) {
      connection.sendAsync(".u.upd", "trade", new long[] {1});
      server.await();
    }
  }

  @Test
  void remoteErrorsKeepTheConnectionOpen() throws Exception {
    try (FakeKdbServer server = new FakeKdbServer(peer -> {
      peer.handshake(3);
      peer.read();
      peer.sendError("type");
      peer.read();
      peer.send(MessageType.RESPONSE, 1L);
    }); Connection connection = new Connection(server.host(), server.port(), "")) {
      assertThatThrownBy(() -> connection.sendSync("1+`a"))
          .isInstanceOf(KException.class)
          .hasMessage("type");
      assertThat(connection.getState()).isEqualTo(Connection.State.READY);
      assertThat(connection.sendSync("1")).isEqualTo(1L);
      server.await();
    }
  }

  @Test
  void refusesSyncRequestsWhileWaiting() throws Exception {
    AtomicReference<Message> refusal = new AtomicReference<>();
    try (FakeKdbServer server = new FakeKdbServer(peer -> {
      peer.handshake(3);
      peer.read();
      peer.send(MessageType.SYNC, new CharVector("til 3"));
      try {
        peer.read();
      } catch (KException e) {
        refusal.set(new Message(MessageType.RESPONSE, e.getMessage()));
      }
      peer.send(MessageType.RESPONSE, 42L);
    }); Connection connection = new Connection(server.host(), server.port(), "")) {
      assertThat(connection.sendSync("x")).isEqualTo(42L);
      server.await();
      assertThat(refusal.get().value()).isEqualTo("unable to process sync requests");
    }
  }

  @Test
  void customHandlerSeesMessagesArrivingDuringASyncCall() throws Exception {
    List<Message> seen = new CopyOnWriteArrayList<>();
    AtomicReference<Object> answer = new AtomicReference<>();
    try (FakeKdbServer server = new FakeKdbServer(peer -> {
      peer.handshake(3);
      peer.read();
      peer.send(MessageType.ASYNC, "tick");
      peer.send(MessageType.SYNC, new CharVector("ping"));
      answer.set(peer.read().value());
      peer.send(MessageType.RESPONSE, 7L);
    }); Connection connection = new Connection(server.host(), server.port(), "")) {
      connection.setMessageHandler((c, message) -> {
        seen.add(message);
        if (message.type() == MessageType.SYNC)
          c.sendResponse("pong");
      });
      assertThat(connection.sendSync("x")).isEqualTo(7L);
      server.await();
      assertThat(seen).containsExactly(
          new Message(MessageType.ASYNC, "tick"),
          new Message(MessageType.SYNC, new CharVector("ping")));
      assertThat(answer.get()).isEqualTo("pong");
    }
  }

  @Test
  void answersRequestsReadFromThePeer() throws Exception {
    AtomicReference<Object> answer = new AtomicReference<>();
    try (FakeKdbServer server = new FakeKdbServer(peer -> {
      peer.handshake(3);
      peer.send(MessageType.SYNC, new CharVector("ping"));
      answer.set(peer.read().value());
    }); Connection connection = new Connection(server.host(), server.port(), "")) {
      Message request = connection.readMessage();
      assertThat(request).isEqualTo(new Message(MessageType.SYNC, new CharVector("ping")));
      connection.sendResponse("pong");
      assertThatThrownBy(() -> connection.sendResponse("again")).isInstanceOf(IpcProtocolException.class);
      server.await();
      assertThat(answer.get()).isEqualTo("pong");
    }
  }

  @Test
  void responseWithoutARequestIsAProtocolError() throws Exception {
    try (FakeKdbServer server = new FakeKdbServer(peer -> peer.handshake(3));
         Connection connection = new Connection(server.host(), server.port(), "")) {
      assertThatThrownBy(() -> connection.sendResponse(1L)).isInstanceOf(IpcProtocolException.class);
      assertThatThrownBy(() -> connection.sendError("nyi")).isInstanceOf(IpcProtocolException.class);
      server.await();
    }
  }

  @Test
  void transportFailureClosesTheConnection() throws Exception {
    try (FakeKdbServer server = new FakeKdbServer(peer -> {
      peer.handshake(3);
      peer.read();
    }); Connection connection = new Connection(server.host(), server.port(), "")) {
      assertThatThrownBy(() -> connection.sendSync("1")).isInstanceOf(IOException.class);
      assertThat(connection.getState()).isEqualTo(Connection.State.DISCONNECTED);
      assertThatThrownBy(() -> connection.sendAsync("1")).isInstanceOf(IllegalStateException.class);
      server.await();
    }
  }

  @Test
  void probesLiveness() throws Exception {
    try (FakeKdbServer server = new FakeKdbServer(peer -> {
      peer.handshake(3);
      assertThat(peer.read().value()).isEqualTo(new CharVector("::"));
      peer.send(MessageType.RESPONSE, null);
    }); Connection connection = new Connection(server.host(), server.port(), "")) {
      assertThat(connection.isConnected()).isTrue();
      server.await();
      assertThat(connection.isConnected()).isFalse();
      assertThat(connection.getState()).isEqualTo(Connection.State.DISCONNECTED);
    }
  }

  @Test
  void closeIsIdempotent() throws Exception {
    try (FakeKdbServer server = new FakeKdbServer(peer -> peer.handshake(3))) {
      Connection connection = new Connection(server.host(), server.port(), "");
      connection.close();
      connection.close();
      assertThat(connection.getState()).isEqualTo(Connection.State.DISCONNECTED);
      assertThat(connection.isConnected()).isFalse();
      server.await();
    }
  }

  @Test
  void neverCompressesForALoopbackPeer() throws Exception {
    try (FakeKdbServer server = new FakeKdbServer(peer -> {
      peer.handshake(3);
      byte[] frame = peer.readFrame();
      assertThat(frame[2]).isZero();
      assertThat(frame).hasSize(8 + 6 + 5000);
    }); Connection connection = new Connection(server.host(), server.port(), "")) {
      assertThat(connection.isCompressionEnabled()).isFalse();
      connection.setCompressionEnabled(true);
      assertThat(connection.isCompressionEnabled()).isTrue();
      connection.sendAsync((Object) new byte[5000]);
      server.await();
    }
  }
}
