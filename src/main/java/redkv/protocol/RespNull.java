package redkv.protocol;

import io.netty.buffer.ByteBuf;

public final class RespNull extends Frame {
    public static final RespNull INSTANCE = new RespNull();

    private RespNull() { }

    @Override
    public FrameType getType() {
        return FrameType.NULL;
    }

    @Override
    public void encode(ByteBuf out) {
        out.writeByte(FrameType.NULL.prefix);
        out.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return "Null";
    }
}
