package com.chauhraj.kdbtick.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.chauhraj.kdbtick.datatypes.CharVector;

class MessageFramerTest {

  private final MessageFramer framer = new MessageFramer(3);

  @Test
  void framesWithABigEndianHeader() {
    assertThat(framer.frame(MessageType.SYNC, 1, false))
        .containsExactly(0, 1, 0, 0, 0, 0, 0, 13, -6, 0, 0, 0, 1);
    assertThat(framer.frame(MessageType.ASYNC, null, false))
        .containsExactly(0, 0, 0, 0, 0, 0, 0, 10, 101, 0);
  }

  @Test
  void framesErrors() {
    byte[] error = framer.frameError("type");
    assertThat(error).containsExactly(0, 2, 0, 0, 0, 0, 0, 14, -128, 't', 'y', 'p', 'e', 0);
    assertThatThrownBy(() -> framer.decode(error))
        .isInstanceOf(KException.class)
        .hasMessage("type");
  }

  @Test
  void decodesLittleEndianMessages() throws KException {
    byte[] message = {1, 2, 0, 0, 13, 0, 0, 0, -6, 5, 0, 0, 0};
    assertThat(framer.decode(message)).isEqualTo(new Message(MessageType.RESPONSE, 5));
  }

  @Test
  void decodesWhatItFrames() throws KException {
    Object[] call = {new CharVector(".u.upd"), "trade", new long[] {1, 2}};
    Message message = framer.decode(framer.frame(MessageType.ASYNC, call, false));
    assertThat(message.type()).isEqualTo(MessageType.ASYNC);
    assertThat((Object[]) message.value()).containsExactly(new CharVector(".u.upd"), "trade", new long[] {1, 2});
  }

  @Test
  void rejectsUnknownMessageKinds() {
    byte[] message = framer.frame(MessageType.SYNC, 1, false);
    message[1] = 3;
    assertThatThrownBy(() -> framer.decode(message)).isInstanceOf(IpcProtocolException.class);
  }

  @Test
  void readsExactlyOneFramePerCall() throws IOException {
    byte[] first = framer.frame(MessageType.SYNC, 1L, false);
    byte[] second = framer.frame(MessageType.ASYNC, "x", false);
    ByteArrayOutputStream stream = new ByteArrayOutputStream();
    stream.write(first);
    stream.write(second);
    ByteArrayInputStream in = new ByteArrayInputStream(stream.toByteArray());

    assertThat(MessageFramer.readFrame(in)).isEqualTo(first);
    assertThat(MessageFramer.readFrame(in)).isEqualTo(second);
    assertThatThrownBy(() -> MessageFramer.readFrame(in)).isInstanceOf(EOFException.class);
  }

  @Test
  void shortReadIsAnEof() {
    byte[] message = framer.frame(MessageType.SYNC, 1L, false);
    byte[] truncated = Arrays.copyOf(message, message.length - 1);
    assertThatThrownBy(() -> MessageFramer.readFrame(new ByteArrayInputStream(truncated)))
        .isInstanceOf(EOFException.class);
  }

  @Test
  void rejectsLengthsShorterThanTheHeader() {
    byte[] header = {0, 1, 0, 0, 0, 0, 0, 4};
    assertThatThrownBy(() -> MessageFramer.readFrame(new ByteArrayInputStream(header)))
        .isInstanceOf(IpcProtocolException.class);
  }
}
