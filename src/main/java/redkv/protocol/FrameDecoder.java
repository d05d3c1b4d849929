package redkv.protocol;

import io.netty.buffer.ByteBuf;

/**
 * Decodes frames from the readable bytes of a buffer.
 * <p>
 * Both methods start at {@link ByteBuf#readerIndex()}. A successful
 * {@link #decode} advances the reader index past exactly one frame; any failure
 * leaves the reader index where it was.
 */
public interface FrameDecoder {

    /**
     * Decodes the next frame.
     *
     * @throws NotCompleteException if more bytes are needed
     * @throws MalformedFrameException if the bytes can never form a valid frame
     */
    Frame decode(ByteBuf in) throws RespException;

    /**
     * Returns the total number of bytes the next frame occupies, so a caller can
     * wait until that many bytes are buffered before decoding.
     *
     * @throws NotCompleteException if the length cannot be known yet
     */
    int expectLength(ByteBuf in) throws RespException;
}
