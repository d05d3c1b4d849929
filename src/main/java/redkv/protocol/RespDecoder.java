package redkv.protocol;

import static redkv.protocol.RespGrammar.CRLF_LEN;
import static redkv.protocol.RespGrammar.checkDepth;
import static redkv.protocol.RespGrammar.checkedLength;
import static redkv.protocol.RespGrammar.lineEnd;
import static redkv.protocol.RespGrammar.parseLength;
import static redkv.protocol.RespGrammar.typeAt;

import io.netty.buffer.ByteBuf;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * Incremental RESP decoder for a growing buffer.
 * <p>
 * Scalars are decoded once their terminating CRLF has arrived. Aggregates
 * (array, map, set) first probe the byte length of the whole nested structure
 * and are only consumed when all of it is buffered, so a {@link NotCompleteException}
 * never leaves a half-read frame behind.
 */
public final class RespDecoder implements FrameDecoder {

    @Override
    public Frame decode(ByteBuf in) throws RespException {
        if (!in.isReadable()) throw NotCompleteException.INSTANCE;
        int start = in.readerIndex();
        try {
            return decodeFrame(in, start, 0);
        } catch (RespException e) {
            in.readerIndex(start);
            throw e;
        }
    }

    @Override
    public int expectLength(ByteBuf in) throws RespException {
        return frameLength(in, in.readerIndex(), 0);
    }

    private Frame decodeFrame(ByteBuf in, int start, int depth) throws RespException {
        FrameType type = typeAt(in, start);
        checkDepth(depth, type);
        int end = lineEnd(in, start + 1);
        int next = end + CRLF_LEN;
        Frame frame;
        switch (type) {
            case SIMPLE_STRING:
                frame = new SimpleString(RespGrammar.text(in, start + 1, end, type));
                break;
            case ERROR:
                frame = new SimpleError(RespGrammar.text(in, start + 1, end, type));
                break;
            case INTEGER:
                frame = RespInteger.valueOf(RespGrammar.parseLong(in, start + 1, end, type));
                break;
            case DOUBLE:
                frame = new RespDouble(RespGrammar.parseDouble(in, start + 1, end));
                break;
            case NULL:
                RespGrammar.checkEmptyLine(in, start + 1, end, type);
                frame = RespNull.INSTANCE;
                break;
            case BOOLEAN:
                frame = RespBoolean.valueOf(RespGrammar.parseBoolean(in, start + 1, end));
                break;
            case BULK_STRING:
                return decodeBulkString(in, start, end);
            case ARRAY:
            case SET:
            case MAP:
                return decodeAggregate(in, start, end, type, depth);
            default:
                throw new MalformedFrameException(type, "unsupported");
        }
        in.readerIndex(next);
        return frame;
    }

    private BulkString decodeBulkString(ByteBuf in, int start, int end) throws RespException {
        int len = parseLength(in, start + 1, end, FrameType.BULK_STRING);
        int dataStart = end + CRLF_LEN;
        if (len == -1) {
            in.readerIndex(dataStart);
            return BulkString.NULL;
        }
        if (in.writerIndex() - dataStart < len + CRLF_LEN) {
            throw NotCompleteException.INSTANCE;
        }
        RespGrammar.expectCrlf(in, dataStart + len, FrameType.BULK_STRING);
        byte[] data = new byte[len];
        in.getBytes(dataStart, data);
        in.readerIndex(dataStart + len + CRLF_LEN);
        return BulkString.wrap(data);
    }

    private Frame decodeAggregate(ByteBuf in, int start, int end, FrameType type, int depth) throws RespException {
        int count = parseLength(in, start + 1, end, type);
        if (count == -1) {
            in.readerIndex(end + CRLF_LEN);
            return RespArray.NULL;
        }
        int total = calcTotalLength(in, start, end, count, type, depth);
        if (in.readableBytes() < total) {
            throw NotCompleteException.INSTANCE;
        }

        in.readerIndex(end + CRLF_LEN);
        if (type == FrameType.MAP) {
            TreeMap<String, Frame> entries = new TreeMap<>();
            for (int i = 0; i < count; i++) {
                SimpleString key = (SimpleString) decodeFrame(in, in.readerIndex(), depth + 1);
                entries.put(key.getValue(), decodeFrame(in, in.readerIndex(), depth + 1));
            }
            return new RespMap(entries);
        }
        List<Frame> items = new ArrayList<>(Math.min(count, 1024));
        for (int i = 0; i < count; i++) {
            items.add(decodeFrame(in, in.readerIndex(), depth + 1));
        }
        return type == FrameType.SET ? new RespSet(items) : new RespArray(items);
    }

    /** Total byte length of the frame starting at {@code start}. */
    private int frameLength(ByteBuf in, int start, int depth) throws RespException {
        if (start >= in.writerIndex()) throw NotCompleteException.INSTANCE;
        FrameType type = typeAt(in, start);
        checkDepth(depth, type);
        int end = lineEnd(in, start + 1);
        switch (type) {
            case BULK_STRING: {
                int len = parseLength(in, start + 1, end, type);
                if (len == -1) return end + CRLF_LEN - start;
                return checkedLength((long) end - start + CRLF_LEN + len + CRLF_LEN, type);
            }
            case ARRAY:
            case SET:
            case MAP: {
                int count = parseLength(in, start + 1, end, type);
                if (count == -1) return end + CRLF_LEN - start;
                return calcTotalLength(in, start, end, count, type, depth);
            }
            default:
                return end + CRLF_LEN - start;
        }
    }

    /**
     * Sums the header and the probed length of every nested frame without
     * building any of them. Map keys must be simple strings.
     */
    private int calcTotalLength(ByteBuf in, int start, int end, int count, FrameType type, int depth) throws RespException {
        long pos = end + CRLF_LEN;
        for (int i = 0; i < count; i++) {
            if (type == FrameType.MAP) {
                if (pos >= in.writerIndex()) throw NotCompleteException.INSTANCE;
                pos += keyLength(in, (int) pos);
            }
            if (pos >= in.writerIndex()) throw NotCompleteException.INSTANCE;
            pos += frameLength(in, (int) pos, depth + 1);
        }
        return checkedLength(pos - start, type);
    }

    private int keyLength(ByteBuf in, int start) throws RespException {
        if (in.getByte(start) != FrameType.SIMPLE_STRING.prefix) {
            throw new MalformedFrameException(FrameType.MAP, "key must be a simple string");
        }
        return lineEnd(in, start + 1) + CRLF_LEN - start;
    }
}
