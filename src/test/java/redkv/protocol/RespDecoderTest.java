package redkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

public class RespDecoderTest {

    private final RespDecoder decoder = new RespDecoder();

    private static ByteBuf buf(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    @Test
    public void testSimpleStringDecode() throws Exception {
        ByteBuf buf = buf("+OK\r\n");
        assertEquals(new SimpleString("OK"), decoder.decode(buf));
        assertEquals(0, buf.readableBytes());

        buf.writeBytes("+hello\r".getBytes(StandardCharsets.UTF_8));
        assertThrows(NotCompleteException.class, () -> decoder.decode(buf));
        assertEquals(7, buf.readableBytes(), "Incomplete decode must not consume");

        buf.writeByte('\n');
        assertEquals(new SimpleString("hello"), decoder.decode(buf));
        assertEquals(0, buf.readableBytes());
    }

    @Test
    public void testErrorAndIntegerDecode() throws Exception {
        assertEquals(new SimpleError("ERR unknown"), decoder.decode(buf("-ERR unknown\r\n")));
        assertEquals(new RespInteger(123), decoder.decode(buf(":123\r\n")));
        assertEquals(new RespInteger(-123), decoder.decode(buf(":-123\r\n")));
        assertEquals(new RespInteger(5), decoder.decode(buf(":+5\r\n")));
        assertEquals(new RespInteger(Long.MIN_VALUE), decoder.decode(buf(":" + Long.MIN_VALUE + "\r\n")));
    }

    @Test
    public void testBulkStringDecode() throws Exception {
        ByteBuf buf = buf("$5\r\nhello\r\n");
        assertEquals(BulkString.of("hello"), decoder.decode(buf));

        buf.writeBytes("$5\r\nworld".getBytes(StandardCharsets.UTF_8));
        assertThrows(NotCompleteException.class, () -> decoder.decode(buf));

        buf.writeBytes("\r\n".getBytes(StandardCharsets.UTF_8));
        assertEquals(BulkString.of("world"), decoder.decode(buf));
    }

    @Test
    public void testBulkStringPayloadMayContainCrlf() throws Exception {
        assertEquals(BulkString.of("a\r\nb"), decoder.decode(buf("$4\r\na\r\nb\r\n")));
    }

    @Test
    public void testNullAndEmptyBulkStringStayDistinct() throws Exception {
        Frame nullBulk = decoder.decode(buf("$-1\r\n"));
        Frame emptyBulk = decoder.decode(buf("$0\r\n\r\n"));

        assertEquals(BulkString.NULL, nullBulk);
        assertTrue(((BulkString) nullBulk).isNull());
        assertFalse(((BulkString) emptyBulk).isNull());
        assertEquals(0, ((BulkString) emptyBulk).length());
        assertNotEquals(nullBulk, emptyBulk);
    }

    @Test
    public void testArrayDecode() throws Exception {
        ByteBuf buf = buf("*2\r\n$3\r\nset\r\n$5\r\nhello\r\n");
        assertEquals(RespArray.of(BulkString.of("set"), BulkString.of("hello")), decoder.decode(buf));

        buf.writeBytes("*2\r\n$3\r\nset\r\n".getBytes(StandardCharsets.UTF_8));
        assertThrows(NotCompleteException.class, () -> decoder.decode(buf));
        assertEquals(13, buf.readableBytes(), "Half an array must not be consumed");

        buf.writeBytes("$5\r\nhello\r\n".getBytes(StandardCharsets.UTF_8));
        assertEquals(RespArray.of(BulkString.of("set"), BulkString.of("hello")), decoder.decode(buf));
        assertEquals(0, buf.readableBytes());
    }

    @Test
    public void testNullAndEmptyArray() throws Exception {
        assertEquals(RespArray.NULL, decoder.decode(buf("*-1\r\n")));
        Frame empty = decoder.decode(buf("*0\r\n"));
        assertEquals(RespArray.EMPTY, empty);
        assertNotEquals(RespArray.NULL, empty);
    }

    @Test
    public void testNestedArray() throws Exception {
        Frame frame = decoder.decode(buf("*2\r\n*1\r\n:1\r\n$2\r\nhi\r\n"));
        assertEquals(RespArray.of(RespArray.of(new RespInteger(1)), BulkString.of("hi")), frame);
    }

    @Test
    public void testNullBooleanDouble() throws Exception {
        assertSame(RespNull.INSTANCE, decoder.decode(buf("_\r\n")));
        assertEquals(RespBoolean.TRUE, decoder.decode(buf("#t\r\n")));
        assertEquals(RespBoolean.FALSE, decoder.decode(buf("#f\r\n")));
        assertEquals(new RespDouble(123.456), decoder.decode(buf(",+123.456\r\n")));
        assertEquals(new RespDouble(-123.456), decoder.decode(buf(",-123.456\r\n")));
        assertEquals(new RespDouble(1.23456e8), decoder.decode(buf(",+1.23456e8\r\n")));
        assertEquals(new RespDouble(Double.POSITIVE_INFINITY), decoder.decode(buf(",inf\r\n")));
        assertEquals(new RespDouble(Double.NaN), decoder.decode(buf(",nan\r\n")));
    }

    @Test
    public void testMapDecode() throws Exception {
        Frame frame = decoder.decode(buf("%2\r\n+hello\r\n$5\r\nworld\r\n+foo\r\n$3\r\nbar\r\n"));

        Map<String, Frame> expected = new TreeMap<>();
        expected.put("hello", BulkString.of("world"));
        expected.put("foo", BulkString.of("bar"));
        assertEquals(new RespMap(expected), frame);
        assertEquals("foo", ((RespMap) frame).getEntries().firstKey());
    }

    @Test
    public void testSetDecode() throws Exception {
        Frame frame = decoder.decode(buf("~2\r\n$4\r\nping\r\n$4\r\npong\r\n"));
        assertEquals(RespSet.of(BulkString.of("ping"), BulkString.of("pong")), frame);
    }

    @Test
    public void testPipelinedFrames() throws Exception {
        ByteBuf buf = buf("+a\r\n:1\r\n$1\r\nb\r\n");
        assertEquals(new SimpleString("a"), decoder.decode(buf));
        assertEquals(new RespInteger(1), decoder.decode(buf));
        assertEquals(BulkString.of("b"), decoder.decode(buf));
        assertThrows(NotCompleteException.class, () -> decoder.decode(buf));
    }

    @Test
    public void testByteByByteFeed() throws Exception {
        String[] samples = {
            "*2\r\n$3\r\nget\r\n$5\r\nhello\r\n",
            "%2\r\n+foo\r\n,-123456.789\r\n+hello\r\n$5\r\nworld\r\n",
            "~3\r\n_\r\n#t\r\n*-1\r\n",
            "$4\r\na\r\nb\r\n",
            "$0\r\n\r\n",
            "*1\r\n*1\r\n*0\r\n",
            ":-42\r\n",
        };
        for (String sample : samples) {
            byte[] bytes = sample.getBytes(StandardCharsets.UTF_8);
            Frame expected = decoder.decode(Unpooled.wrappedBuffer(bytes));

            ByteBuf buf = Unpooled.buffer();
            for (int i = 0; i < bytes.length; i++) {
                buf.writeByte(bytes[i]);
                if (i < bytes.length - 1) {
                    int readable = buf.readableBytes();
                    assertThrows(NotCompleteException.class, () -> decoder.decode(buf), sample);
                    assertEquals(readable, buf.readableBytes(), sample);
                }
            }
            assertEquals(expected, decoder.decode(buf), sample);
            assertEquals(0, buf.readableBytes(), sample);
        }
    }

    @Test
    public void testMalformedFrames() {
        String[] samples = {
            "$abc\r\n",
            "$-2\r\n",
            "?foo\r\n",
            ":12a\r\n",
            ":\r\n",
            "#x\r\n",
            "_x\r\n",
            ",1.2.3\r\n",
            ",1d\r\n",
            "$3\r\nabcd\r\n",
            "~-1\r\n",
            "%-1\r\n",
            "%1\r\n:1\r\n:2\r\n",
            "+a\nb\r\n",
            "*1\r\n?\r\n",
        };
        for (String sample : samples) {
            ByteBuf buf = buf(sample);
            assertThrows(MalformedFrameException.class, () -> decoder.decode(buf), sample);
            assertEquals(0, buf.readerIndex(), sample);
        }
    }

    @Test
    public void testMalformedNestedFrameDoesNotConsume() {
        ByteBuf buf = buf("*2\r\n:1\r\n:x\r\n");
        assertThrows(MalformedFrameException.class, () -> decoder.decode(buf));
        assertEquals(0, buf.readerIndex());
    }

    @Test
    public void testInvalidUtf8Text() {
        ByteBuf buf = Unpooled.wrappedBuffer(new byte[] {'+', (byte) 0xff, (byte) 0xfe, '\r', '\n'});
        MalformedFrameException e = assertThrows(MalformedFrameException.class, () -> decoder.decode(buf));
        assertTrue(e.getMessage().contains("UTF-8"));
    }

    @Test
    public void testEmptyBufferIsIncomplete() {
        assertThrows(NotCompleteException.class, () -> decoder.decode(Unpooled.buffer()));
    }

    @Test
    public void testExpectLength() throws Exception {
        assertEquals(5, decoder.expectLength(buf("+OK\r\n")));
        assertEquals(5, decoder.expectLength(buf("$-1\r\n")));
        // declared length is known before the payload arrives
        assertEquals(11, decoder.expectLength(buf("$5\r\nhel")));
        assertEquals(24, decoder.expectLength(buf("*2\r\n$3\r\nset\r\n$5\r\nhello\r\n")));
        assertEquals(24, decoder.expectLength(buf("*2\r\n$3\r\nset\r\n$5\r\nhello\r\n+trailing\r\n")));
        assertThrows(NotCompleteException.class, () -> decoder.expectLength(buf("*2\r\n$3\r\nset\r\n")));
        assertThrows(NotCompleteException.class, () -> decoder.expectLength(buf("+OK")));
        assertThrows(MalformedFrameException.class, () -> decoder.expectLength(buf("$x\r\n")));
    }

    @Test
    public void testExpectLengthDoesNotMoveReaderIndex() throws Exception {
        ByteBuf buf = buf("%1\r\n+k\r\n:1\r\n");
        assertEquals(buf.readableBytes(), decoder.expectLength(buf));
        assertEquals(0, buf.readerIndex());
    }

    static String nested(int levels, String innermost) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < levels; i++) {
            sb.append("*1\r\n");
        }
        return sb.append(innermost).toString();
    }

    @Test
    public void testDeepNestingIsMalformed() {
        ByteBuf buf = buf(nested(100000, ":1\r\n"));

        assertThrows(MalformedFrameException.class, () -> decoder.decode(buf));
        assertEquals(0, buf.readerIndex());
        assertThrows(MalformedFrameException.class, () -> decoder.expectLength(buf));

        // known to be too deep before the rest arrives
        ByteBuf partial = buf(nested(RespGrammar.MAX_DEPTH + 2, ""));
        assertThrows(MalformedFrameException.class, () -> decoder.decode(partial));
        assertEquals(0, partial.readerIndex());
    }

    @Test
    public void testNestingAtLimitDecodes() throws Exception {
        String wire = nested(RespGrammar.MAX_DEPTH, ":1\r\n");
        ByteBuf buf = buf(wire);

        assertEquals(wire.length(), decoder.expectLength(buf));
        Frame frame = decoder.decode(buf);
        assertEquals(0, buf.readableBytes());
        for (int i = 0; i < RespGrammar.MAX_DEPTH; i++) {
            frame = ((RespArray) frame).get(0);
        }
        assertEquals(RespInteger.ONE, frame);

        assertThrows(MalformedFrameException.class, () -> decoder.decode(buf(nested(RespGrammar.MAX_DEPTH + 1, ":1\r\n"))));
    }
}
