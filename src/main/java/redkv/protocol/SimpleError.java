package redkv.protocol;

import io.netty.buffer.ByteBuf;

public final class SimpleError extends Frame {
    private final String message;

    public SimpleError(String message) {
        this.message = checkLineText(message, "error message");
    }

    public String getMessage() {
        return message;
    }

    @Override
    public FrameType getType() {
        return FrameType.ERROR;
    }

    @Override
    public void encode(ByteBuf out) {
        writeLine(out, FrameType.ERROR, message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimpleError)) return false;
        return message.equals(((SimpleError) o).message);
    }

    @Override
    public int hashCode() {
        return message.hashCode();
    }

    @Override
    public String toString() {
        return "SimpleError(" + message + ")";
    }
}
