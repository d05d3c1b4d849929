package redkv.protocol;

import io.netty.buffer.ByteBuf;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A length-prefixed binary string. A null payload is the null bulk string
 * ({@code $-1}), which is distinct from the empty one ({@code $0}).
 */
public final class BulkString extends Frame {
    public static final BulkString NULL = new BulkString(null);

    private final byte[] data;

    /** Copies {@code data}; null gives the null bulk string. */
    public BulkString(byte[] data) {
        this(data, true);
    }

    private BulkString(byte[] data, boolean copy) {
        this.data = copy && data != null ? data.clone() : data;
    }

    // takes ownership of a freshly allocated payload
    static BulkString wrap(byte[] data) {
        return new BulkString(data, false);
    }

    public static BulkString of(String s) {
        return wrap(s.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isNull() {
        return data == null;
    }

    /** The payload, owned by this frame; callers must not modify it. Null for the null bulk string. */
    public byte[] getBytes() {
        return data;
    }

    public int length() {
        return data == null ? -1 : data.length;
    }

    @Override
    public FrameType getType() {
        return FrameType.BULK_STRING;
    }

    @Override
    public void encode(ByteBuf out) {
        writeLine(out, FrameType.BULK_STRING, length());
        if (data != null) {
            out.writeBytes(data);
            out.writeBytes(CRLF);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BulkString)) return false;
        return Arrays.equals(data, ((BulkString) o).data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        if (data == null) return "BulkString(null)";
        return "BulkString(" + new String(data, StandardCharsets.UTF_8) + ")";
    }
}
