package redkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

/**
 * One value of the RESP type system.
 * <p>
 * Every frame has exactly one wire encoding. Subclasses are immutable; the set of
 * subclasses is closed and mirrors {@link FrameType}.
 */
public abstract class Frame {
    static final byte[] CRLF = {'\r', '\n'};

    Frame() { }

    public abstract FrameType getType();

    /** Appends the wire encoding of this frame to {@code out}. */
    public abstract void encode(ByteBuf out);

    public byte[] encode() {
        ByteBuf buf = Unpooled.buffer();
        try {
            encode(buf);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    // <prefix><text>\r\n
    static void writeLine(ByteBuf out, FrameType type, CharSequence text) {
        out.writeByte(type.prefix);
        ByteBufUtil.writeUtf8(out, text);
        out.writeBytes(CRLF);
    }

    static void writeLine(ByteBuf out, FrameType type, long value) {
        out.writeByte(type.prefix);
        ByteBufUtil.writeAscii(out, Long.toString(value));
        out.writeBytes(CRLF);
    }

    static String checkLineText(String text, String what) {
        if (text == null) throw new NullPointerException(what + " must not be null");
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            throw new IllegalArgumentException(what + " must not contain CR or LF");
        }
        return text;
    }
}
