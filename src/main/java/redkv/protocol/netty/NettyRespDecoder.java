package redkv.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import java.util.List;
import redkv.protocol.FrameDecoder;
import redkv.protocol.NotCompleteException;
import redkv.protocol.RespException;
import redkv.utils.Log;

/**
 * Netty decoder for RESP (Redis Serialization Protocol).
 * <p>
 * For every frame it asks the {@link FrameDecoder} how many bytes the frame
 * needs, waits until they are buffered, then decodes it. Several pipelined
 * frames in one read produce several messages. A malformed frame, or more
 * unparsed bytes than {@code maxFrameBytes}, closes the connection.
 */
public class NettyRespDecoder extends ByteToMessageDecoder {

    private final FrameDecoder frameDecoder;
    private final long maxFrameBytes;

    public NettyRespDecoder(FrameDecoder frameDecoder, long maxFrameBytes) {
        this.frameDecoder = frameDecoder;
        this.maxFrameBytes = maxFrameBytes;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        while (in.isReadable()) {
            try {
                int expected = frameDecoder.expectLength(in);
                if (expected > maxFrameBytes) {
                    reject(ctx, in, "frame of " + expected + " bytes exceeds limit of " + maxFrameBytes);
                    return;
                }
                if (in.readableBytes() < expected) {
                    return; // Wait for more data
                }
                out.add(frameDecoder.decode(in));
            } catch (NotCompleteException e) {
                if (in.readableBytes() > maxFrameBytes) {
                    reject(ctx, in, in.readableBytes() + " buffered bytes exceed limit of " + maxFrameBytes);
                }
                return;
            } catch (RespException e) {
                reject(ctx, in, e.getMessage());
                return;
            }
        }
    }

    private void reject(ChannelHandlerContext ctx, ByteBuf in, String reason) {
        Log.warn("Protocol error from " + ctx.channel().remoteAddress() + ": " + reason + ". Closing connection.");
        in.skipBytes(in.readableBytes());
        ctx.close();
    }
}
