package redkv.protocol;

import io.netty.buffer.ByteBuf;

public final class RespInteger extends Frame {
    public static final RespInteger ZERO = new RespInteger(0);
    public static final RespInteger ONE = new RespInteger(1);

    private final long value;

    public RespInteger(long value) {
        this.value = value;
    }

    public static RespInteger valueOf(long value) {
        if (value == 0) return ZERO;
        if (value == 1) return ONE;
        return new RespInteger(value);
    }

    public long getValue() {
        return value;
    }

    @Override
    public FrameType getType() {
        return FrameType.INTEGER;
    }

    @Override
    public void encode(ByteBuf out) {
        writeLine(out, FrameType.INTEGER, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespInteger)) return false;
        return value == ((RespInteger) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "Integer(" + value + ")";
    }
}
