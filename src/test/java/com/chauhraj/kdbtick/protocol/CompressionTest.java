package com.chauhraj.kdbtick.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.chauhraj.kdbtick.datatypes.CharVector;

class CompressionTest {

  private final MessageFramer framer = new MessageFramer(3);

  @Test
  void smallMessagesAreSentAsIs() {
    assertThat(framer.frame(MessageType.ASYNC, new byte[0], true)[2]).isZero();
    assertThat(framer.frame(MessageType.ASYNC, new byte[1], true)[2]).isZero();
    // 8 + 6 + 1986 = 2000 bytes, not above the threshold
    assertThat(framer.frame(MessageType.ASYNC, new byte[1986], true)).hasSize(2000);
    assertThat(framer.frame(MessageType.ASYNC, new byte[1986], true)[2]).isZero();
  }

  @Test
  void compressesAboveTheThreshold() {
    byte[] plain = framer.frame(MessageType.ASYNC, new byte[1987], false);
    byte[] compressed = framer.frame(MessageType.ASYNC, new byte[1987], true);

    assertThat(plain).hasSize(2001);
    assertThat(compressed[2]).isEqualTo((byte) 1);
    assertThat(compressed.length).isLessThan(plain.length / 2);
    assertThat(Compression.getInt(compressed, 4, false)).isEqualTo(compressed.length);
    assertThat(Compression.getInt(compressed, 8, false)).isEqualTo(plain.length);
    assertThat(Compression.decompress(compressed)).isEqualTo(plain);
  }

  @Test
  void restoresLargeRepetitiveMessages() throws KException {
    StringBuilder sb = new StringBuilder();
    while (sb.length() < 100_000)
      sb.append("the quick brown fox jumps over the lazy dog ");
    CharVector text = new CharVector(sb.toString());
    byte[] plain = framer.frame(MessageType.SYNC, text, false);
    byte[] compressed = Compression.compress(plain);

    assertThat(compressed.length).isLessThan(plain.length / 10);
    assertThat(Compression.decompress(compressed)).isEqualTo(plain);
    assertThat(framer.decode(compressed).value()).isEqualTo(text);
  }

  @Test
  void restoresModeratelyCompressibleMessages() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < 300; i++)
      sb.append("{\"entity_id\":\"sensor.living_room_temperature\",\"state\":\"")
          .append(18 + i % 9).append('.').append(i % 10).append("\",\"unit\":\"C\"}\n");
    byte[] plain = framer.frame(MessageType.ASYNC, new CharVector(sb.toString()), false);
    byte[] compressed = Compression.compress(plain, plain.length);

    assertThat(compressed[2]).isEqualTo((byte) 1);
    assertThat(compressed.length).isLessThan(plain.length);
    assertThat(Compression.decompress(compressed)).isEqualTo(plain);
  }

  @Test
  void incompressibleMessagesComeBackUnchanged() {
    byte[] noise = new byte[10_000];
    new Random(42).nextBytes(noise);
    byte[] plain = framer.frame(MessageType.ASYNC, noise, false);
    byte[] copy = plain.clone();

    assertThat(Compression.compress(plain)).isSameAs(plain);
    assertThat(plain).isEqualTo(copy);
    assertThat(framer.frame(MessageType.ASYNC, noise, true)).isEqualTo(plain);
  }

  private static byte[] message(int bodyLength, boolean random) {
    byte[] message = new byte[8 + bodyLength];
    if (random) {
      new Random(bodyLength).nextBytes(message);
    } else {
      for (int i = 8; i < message.length; i++)
        message[i] = (byte) ("abcabcabd".charAt(i % 9) + i / 500);
    }
    message[0] = 0;
    message[1] = 0;
    message[2] = 0;
    message[3] = 0;
    Compression.putInt(message, 4, message.length, false);
    return message;
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 1999, 2000, 2001, 70_000})
  void decompressInvertsCompress(int bodyLength) {
    for (boolean random : new boolean[] {false, true}) {
      byte[] plain = message(bodyLength, random);
      byte[] copy = plain.clone();
      byte[] compressed = Compression.compress(plain);
      assertThat(Compression.decompress(compressed)).as("body %d random %s", bodyLength, random).isEqualTo(copy);
      if (random)
        assertThat(compressed).isSameAs(plain);
    }
  }

  @Test
  void headerOnlyMessagesAreNotCompressed() {
    byte[] header = new byte[8];
    assertThat(Compression.compress(header)).isSameAs(header);
  }

  @Test
  void uncompressedMessagesPassThrough() {
    byte[] plain = framer.frame(MessageType.ASYNC, 1L, false);
    assertThat(Compression.decompress(plain)).isSameAs(plain);
  }

  @Test
  void rejectsMalformedStreams() {
    byte[] plain = framer.frame(MessageType.ASYNC, new byte[5000], false);
    byte[] compressed = Compression.compress(plain);
    byte[] truncated = Arrays.copyOf(compressed, compressed.length - 10);

    assertThatThrownBy(() -> Compression.decompress(truncated))
        .isInstanceOf(IpcProtocolException.class)
        .hasMessage("malformed compressed message");
  }

  @Test
  void rejectsUnknownCompressionFlag() {
    byte[] message = framer.frame(MessageType.ASYNC, 1L, false);
    message[2] = 7;
    assertThatThrownBy(() -> Compression.decompress(message)).isInstanceOf(IpcProtocolException.class);
  }
}
