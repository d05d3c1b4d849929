package redkv.protocol;

import static redkv.protocol.RespGrammar.CRLF_LEN;
import static redkv.protocol.RespGrammar.checkDepth;
import static redkv.protocol.RespGrammar.lineEnd;
import static redkv.protocol.RespGrammar.parseLength;
import static redkv.protocol.RespGrammar.typeAt;

import io.netty.buffer.ByteBuf;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Two-pass RESP decoder for callers that buffer whole frames.
 * <p>
 * {@link #parseFrameLength} walks the grammar over the buffered bytes and only
 * computes where the next frame ends; it allocates nothing on success and
 * reports every failure as {@link NotCompleteException}, except nesting beyond
 * the depth limit, which no further bytes can repair. {@link #parseFrame}
 * then builds the frame from exactly that span with a recursive-descent parser.
 * Since the span is known to be complete, a failure in the second pass is
 * always a {@link MalformedFrameException}.
 */
public final class BatchRespDecoder implements FrameDecoder {

    @Override
    public Frame decode(ByteBuf in) throws RespException {
        int len = parseFrameLength(in);
        Frame frame = parseFrame(in.slice(in.readerIndex(), len));
        in.skipBytes(len);
        return frame;
    }

    @Override
    public int expectLength(ByteBuf in) throws RespException {
        return parseFrameLength(in);
    }

    /**
     * Returns the byte length of the next complete frame.
     *
     * @throws NotCompleteException if no complete, well-formed span is buffered yet
     * @throws MalformedFrameException if the frame nests deeper than the limit
     */
    public int parseFrameLength(ByteBuf in) throws RespException {
        int start = in.readerIndex();
        try {
            return advance(in, start, 0) - start;
        } catch (NestingTooDeepException e) {
            throw e;
        } catch (RespException e) {
            throw NotCompleteException.INSTANCE;
        }
    }

    /**
     * Parses a span holding exactly one frame.
     */
    public Frame parseFrame(ByteBuf span) throws MalformedFrameException {
        Frame frame;
        try {
            frame = parse(span, 0);
        } catch (NotCompleteException e) {
            throw new MalformedFrameException("truncated frame");
        } catch (MalformedFrameException e) {
            throw e;
        } catch (RespException e) {
            throw new MalformedFrameException(e.getMessage());
        }
        if (span.isReadable()) {
            throw new MalformedFrameException(span.readableBytes() + " trailing bytes after frame");
        }
        return frame;
    }

    // Phase one: returns the index just past the frame starting at pos.
    private int advance(ByteBuf in, int pos, int depth) throws RespException {
        if (pos >= in.writerIndex()) throw NotCompleteException.INSTANCE;
        FrameType type = typeAt(in, pos);
        checkDepth(depth, type);
        int end = lineEnd(in, pos + 1);
        int next = end + CRLF_LEN;
        switch (type) {
            case BULK_STRING: {
                int len = parseLength(in, pos + 1, end, type);
                if (len == -1) return next;
                if (in.writerIndex() - next < len + CRLF_LEN) throw NotCompleteException.INSTANCE;
                RespGrammar.expectCrlf(in, next + len, type);
                return next + len + CRLF_LEN;
            }
            case ARRAY:
            case SET: {
                int count = parseLength(in, pos + 1, end, type);
                for (int i = 0; i < count; i++) {
                    next = advance(in, next, depth + 1);
                }
                return next;
            }
            case MAP: {
                int count = parseLength(in, pos + 1, end, type);
                for (int i = 0; i < count; i++) {
                    if (next >= in.writerIndex()) throw NotCompleteException.INSTANCE;
                    if (in.getByte(next) != FrameType.SIMPLE_STRING.prefix) {
                        throw new MalformedFrameException(type, "key must be a simple string");
                    }
                    next = lineEnd(in, next + 1) + CRLF_LEN;
                    next = advance(in, next, depth + 1);
                }
                return next;
            }
            default:
                return next;
        }
    }

    // Phase two: recursive descent, consuming from the span's reader index.
    private Frame parse(ByteBuf in, int depth) throws RespException {
        if (!in.isReadable()) throw NotCompleteException.INSTANCE;
        int start = in.readerIndex();
        FrameType type = typeAt(in, start);
        checkDepth(depth, type);
        int end = lineEnd(in, start + 1);
        in.readerIndex(end + CRLF_LEN);
        switch (type) {
            case SIMPLE_STRING:
                return new SimpleString(RespGrammar.text(in, start + 1, end, type));
            case ERROR:
                return new SimpleError(RespGrammar.text(in, start + 1, end, type));
            case INTEGER:
                return RespInteger.valueOf(RespGrammar.parseLong(in, start + 1, end, type));
            case DOUBLE:
                return new RespDouble(RespGrammar.parseDouble(in, start + 1, end));
            case NULL:
                RespGrammar.checkEmptyLine(in, start + 1, end, type);
                return RespNull.INSTANCE;
            case BOOLEAN:
                return RespBoolean.valueOf(RespGrammar.parseBoolean(in, start + 1, end));
            case BULK_STRING:
                return bulkString(in, parseLength(in, start + 1, end, type));
            case ARRAY:
            case SET:
                return sequence(in, parseLength(in, start + 1, end, type), type, depth);
            case MAP:
                return map(in, parseLength(in, start + 1, end, type), depth);
            default:
                throw new MalformedFrameException(type, "unsupported");
        }
    }

    private BulkString bulkString(ByteBuf in, int len) throws RespException {
        if (len == -1) return BulkString.NULL;
        if (in.readableBytes() < len + CRLF_LEN) throw NotCompleteException.INSTANCE;
        RespGrammar.expectCrlf(in, in.readerIndex() + len, FrameType.BULK_STRING);
        byte[] data = new byte[len];
        in.readBytes(data);
        in.skipBytes(CRLF_LEN);
        return BulkString.wrap(data);
    }

    private Frame sequence(ByteBuf in, int count, FrameType type, int depth) throws RespException {
        if (count == -1) return RespArray.NULL;
        List<Frame> items = new ArrayList<>(Math.min(count, 1024));
        for (int i = 0; i < count; i++) {
            items.add(parse(in, depth + 1));
        }
        return type == FrameType.SET ? new RespSet(items) : new RespArray(items);
    }

    private RespMap map(ByteBuf in, int count, int depth) throws RespException {
        TreeMap<String, Frame> entries = new TreeMap<>();
        for (int i = 0; i < count; i++) {
            Frame key = parse(in, depth + 1);
            if (!(key instanceof SimpleString)) {
                throw new MalformedFrameException(FrameType.MAP, "key must be a simple string");
            }
            entries.put(((SimpleString) key).getValue(), parse(in, depth + 1));
        }
        return new RespMap(entries);
    }
}
