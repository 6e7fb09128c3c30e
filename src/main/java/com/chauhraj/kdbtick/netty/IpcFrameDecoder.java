package com.chauhraj.kdbtick.netty;

import java.nio.ByteOrder;

import com.chauhraj.kdbtick.Connection;
import com.chauhraj.kdbtick.protocol.MessageFramer;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;

/**
 * Splits a byte stream into kdb+ IPC messages and decodes each one into a
 * {@link com.chauhraj.kdbtick.protocol.Message}.
 * <p>
 * The length field is read in the byte order declared by each message's own header. A remote error
 * message is reported through {@code exceptionCaught} as a {@link io.netty.handler.codec.DecoderException}
 * caused by a {@link com.chauhraj.kdbtick.protocol.KException}.
 * </p>
 */
public class IpcFrameDecoder extends LengthFieldBasedFrameDecoder {

  /** Largest message accepted by default, the kdb+ limit for a single IPC message. */
  public static final int DEFAULT_MAX_FRAME_LENGTH = Integer.MAX_VALUE;

  private final MessageFramer framer = new MessageFramer(Connection.MAX_IPC_VERSION);

  public IpcFrameDecoder() {
    this(DEFAULT_MAX_FRAME_LENGTH);
  }

  public IpcFrameDecoder(int maxFrameLength) {
    super(maxFrameLength, 4, 4, -MessageFramer.HEADER_SIZE, 0);
  }

  @Override
  protected Object decode(ChannelHandlerContext ctx, ByteBuf in) throws Exception {
    ByteBuf frame = (ByteBuf) super.decode(ctx, in);
    if (frame == null)
      return null;
    try {
      return framer.decode(ByteBufUtil.getBytes(frame));
    } finally {
      frame.release();
    }
  }

  @Override
  protected long getUnadjustedFrameLength(ByteBuf buf, int offset, int length, ByteOrder order) {
    // byte 0 of the header, four bytes before the length field
    boolean littleEndian = buf.getByte(offset - 4) == 1;
    return littleEndian ? buf.getUnsignedIntLE(offset) : buf.getUnsignedInt(offset);
  }
}
