package redkv.protocol;

import io.netty.buffer.ByteBuf;

public final class RespBoolean extends Frame {
    public static final RespBoolean TRUE = new RespBoolean(true);
    public static final RespBoolean FALSE = new RespBoolean(false);

    private final boolean value;

    private RespBoolean(boolean value) {
        this.value = value;
    }

    public static RespBoolean valueOf(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public FrameType getType() {
        return FrameType.BOOLEAN;
    }

    @Override
    public void encode(ByteBuf out) {
        out.writeByte(FrameType.BOOLEAN.prefix);
        out.writeByte(value ? 't' : 'f');
        out.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return "Boolean(" + value + ")";
    }
}
