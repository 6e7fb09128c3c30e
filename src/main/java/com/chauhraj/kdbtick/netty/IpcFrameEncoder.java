package com.chauhraj.kdbtick.netty;

import com.chauhraj.kdbtick.protocol.Message;
import com.chauhraj.kdbtick.protocol.MessageFramer;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * Frames outbound {@link Message}s as kdb+ IPC messages.
 */
public class IpcFrameEncoder extends MessageToByteEncoder<Message> {
  private final MessageFramer framer;
  private final boolean compress;

  /**
   * @param ipcVersion protocol version negotiated with the peer
   * @param compress compress messages above the size threshold; leave off for a loopback peer
   */
  public IpcFrameEncoder(int ipcVersion, boolean compress) {
    this.framer = new MessageFramer(ipcVersion);
    this.compress = compress;
  }

  @Override
  protected void encode(ChannelHandlerContext ctx, Message msg, ByteBuf out) {
    out.writeBytes(framer.frame(msg.type(), msg.value(), compress));
  }
}
