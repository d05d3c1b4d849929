package redkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.util.ByteProcessor;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Token-level rules shared by {@link RespDecoder} and {@link BatchRespDecoder}.
 * All positions are absolute buffer indexes; nothing here moves a reader index.
 */
final class RespGrammar {
    static final int CRLF_LEN = 2;
    /** Deepest aggregate nesting accepted; the outermost frame is at depth 0. */
    static final int MAX_DEPTH = 512;

    private static final Pattern DOUBLE = Pattern.compile("[+-]?[0-9]+(\\.[0-9]+)?([eE][+-]?[0-9]+)?");

    private RespGrammar() { }

    static FrameType typeAt(ByteBuf buf, int index) throws MalformedFrameException {
        byte prefix = buf.getByte(index);
        FrameType type = FrameType.fromPrefix(prefix);
        if (type == null) {
            throw new MalformedFrameException("unknown frame prefix 0x" + Integer.toHexString(prefix & 0xff));
        }
        return type;
    }

    /**
     * Returns the index of the CR of the first CRLF at or after {@code from}.
     */
    static int lineEnd(ByteBuf buf, int from) throws NotCompleteException {
        int limit = buf.writerIndex() - 1;
        int i = from;
        while (i < limit) {
            int cr = buf.indexOf(i, limit, (byte) '\r');
            if (cr < 0) break;
            if (buf.getByte(cr + 1) == '\n') return cr;
            i = cr + 1;
        }
        throw NotCompleteException.INSTANCE;
    }

    static void checkDepth(int depth, FrameType type) throws NestingTooDeepException {
        if (depth > MAX_DEPTH) {
            throw new NestingTooDeepException(type, MAX_DEPTH);
        }
    }

    static void expectCrlf(ByteBuf buf, int index, FrameType type) throws MalformedFrameException {
        if (buf.getByte(index) != '\r' || buf.getByte(index + 1) != '\n') {
            throw new MalformedFrameException(type, "payload not terminated by CRLF");
        }
    }

    /** Parses {@code [+|-]digits} in [from, to) without allocating. */
    static long parseLong(ByteBuf buf, int from, int to, FrameType type) throws MalformedFrameException {
        int i = from;
        boolean negative = false;
        if (i < to) {
            byte first = buf.getByte(i);
            if (first == '+' || first == '-') {
                negative = first == '-';
                i++;
            }
        }
        if (i >= to) {
            throw new MalformedFrameException(type, "missing digits");
        }
        long limit = negative ? Long.MIN_VALUE : -Long.MAX_VALUE;
        long multMin = limit / 10;
        long result = 0;
        for (; i < to; i++) {
            int digit = buf.getByte(i) - '0';
            if (digit < 0 || digit > 9) {
                throw new MalformedFrameException(type, "not a number: " + ascii(buf, from, to));
            }
            if (result < multMin) {
                throw new MalformedFrameException(type, "number out of range: " + ascii(buf, from, to));
            }
            result *= 10;
            if (result < limit + digit) {
                throw new MalformedFrameException(type, "number out of range: " + ascii(buf, from, to));
            }
            result -= digit;
        }
        return negative ? result : -result;
    }

    /**
     * Parses a length or element count. Returns -1 for the null sentinel of the
     * nullable types; every other negative value is malformed.
     */
    static int parseLength(ByteBuf buf, int from, int to, FrameType type) throws MalformedFrameException {
        long len = parseLong(buf, from, to, type);
        if (len == -1) {
            if (type.isNullable()) return -1;
            throw new MalformedFrameException(type, "null length not allowed");
        }
        if (len < 0) {
            throw new MalformedFrameException(type, "negative length " + len);
        }
        if (len > Integer.MAX_VALUE - 2 * CRLF_LEN) {
            throw new MalformedFrameException(type, "length too large " + len);
        }
        return (int) len;
    }

    static double parseDouble(ByteBuf buf, int from, int to) throws MalformedFrameException {
        String s = ascii(buf, from, to);
        switch (s) {
            case "inf":
            case "+inf":
                return Double.POSITIVE_INFINITY;
            case "-inf":
                return Double.NEGATIVE_INFINITY;
            case "nan":
                return Double.NaN;
            default:
                if (!DOUBLE.matcher(s).matches()) {
                    throw new MalformedFrameException(FrameType.DOUBLE, "not a number: " + s);
                }
                return Double.parseDouble(s);
        }
    }

    static boolean parseBoolean(ByteBuf buf, int from, int to) throws MalformedFrameException {
        if (to - from == 1) {
            byte b = buf.getByte(from);
            if (b == 't') return true;
            if (b == 'f') return false;
        }
        throw new MalformedFrameException(FrameType.BOOLEAN, "expected t or f");
    }

    static void checkEmptyLine(ByteBuf buf, int from, int to, FrameType type) throws MalformedFrameException {
        if (to != from) {
            throw new MalformedFrameException(type, "unexpected data " + ascii(buf, from, to));
        }
    }

    /** Decodes one line of UTF-8 text; lone CR or LF bytes are rejected. */
    static String text(ByteBuf buf, int from, int to, FrameType type) throws MalformedFrameException {
        int len = to - from;
        if (len > 0 && buf.forEachByte(from, len, ByteProcessor.FIND_CRLF) >= 0) {
            throw new MalformedFrameException(type, "line contains CR or LF");
        }
        if (!ByteBufUtil.isText(buf, from, len, StandardCharsets.UTF_8)) {
            throw new MalformedFrameException(type, "text is not valid UTF-8");
        }
        return buf.toString(from, len, StandardCharsets.UTF_8);
    }

    static int checkedLength(long length, FrameType type) throws MalformedFrameException {
        if (length > Integer.MAX_VALUE) {
            throw new MalformedFrameException(type, "frame too large");
        }
        return (int) length;
    }

    private static String ascii(ByteBuf buf, int from, int to) {
        return buf.toString(from, to - from, StandardCharsets.US_ASCII);
    }
}
