package redkv.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import redkv.protocol.Frame;

/**
 * Writes reply frames in their RESP encoding.
 */
public class NettyRespEncoder extends MessageToByteEncoder<Frame> {

    @Override
    protected void encode(ChannelHandlerContext ctx, Frame msg, ByteBuf out) throws Exception {
        msg.encode(out);
    }
}
