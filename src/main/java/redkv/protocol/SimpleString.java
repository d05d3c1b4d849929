package redkv.protocol;

import io.netty.buffer.ByteBuf;

public final class SimpleString extends Frame {
    public static final SimpleString OK = new SimpleString("OK");

    private final String value;

    public SimpleString(String value) {
        this.value = checkLineText(value, "simple string");
    }

    public String getValue() {
        return value;
    }

    @Override
    public FrameType getType() {
        return FrameType.SIMPLE_STRING;
    }

    @Override
    public void encode(ByteBuf out) {
        writeLine(out, FrameType.SIMPLE_STRING, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimpleString)) return false;
        return value.equals(((SimpleString) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "SimpleString(" + value + ")";
    }
}
