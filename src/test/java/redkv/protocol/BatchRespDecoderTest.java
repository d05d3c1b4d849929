package redkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class BatchRespDecoderTest {

    private final BatchRespDecoder decoder = new BatchRespDecoder();

    private static ByteBuf buf(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    @Test
    public void testParseFrameLength() throws Exception {
        assertEquals(10, decoder.parseFrameLength(buf("$4\r\nping\r\n")));
        assertEquals(24, decoder.parseFrameLength(buf("*2\r\n$4\r\nping\r\n$4\r\npong\r\n")));
        assertEquals(29, decoder.parseFrameLength(buf("%2\r\n+first\r\n:1\r\n+second\r\n:2\r\n")));
        assertEquals(24, decoder.parseFrameLength(buf("~2\r\n$4\r\nping\r\n$4\r\npong\r\n")));
        assertEquals(5, decoder.parseFrameLength(buf("$-1\r\n")));
        assertEquals(5, decoder.parseFrameLength(buf("*-1\r\n")));
        assertEquals(6, decoder.parseFrameLength(buf("$0\r\n\r\n")));
        assertEquals(5, decoder.parseFrameLength(buf("+OK\r\n+trailing\r\n")));
    }

    @Test
    public void testParseFrameLengthReportsOnlyNotComplete() {
        String[] samples = {
            "+OK\r",
            "$4\r\npin",
            "*2\r\n$4\r\nping\r\n",
            "%1\r\n+k\r\n",
            // malformed input is never reported by the length pass
            "$abc\r\n",
            "?\r\n",
            "%1\r\n:1\r\n:2\r\n",
            "$3\r\nabcd\r\n",
        };
        for (String sample : samples) {
            ByteBuf buf = buf(sample);
            assertThrows(NotCompleteException.class, () -> decoder.parseFrameLength(buf), sample);
            assertEquals(0, buf.readerIndex(), sample);
        }
    }

    @Test
    public void testParseFrame() throws Exception {
        assertEquals(BulkString.of("ping"), decoder.parseFrame(buf("$4\r\nping\r\n")));
        assertEquals(new BulkString(new byte[0]), decoder.parseFrame(buf("$0\r\n\r\n")));
        assertEquals(BulkString.NULL, decoder.parseFrame(buf("$-1\r\n")));
        assertEquals(RespArray.NULL, decoder.parseFrame(buf("*-1\r\n")));
        assertEquals(RespArray.of(BulkString.of("ping"), BulkString.of("pong")),
                decoder.parseFrame(buf("*2\r\n$4\r\nping\r\n$4\r\npong\r\n")));
        assertEquals(new RespDouble(-1.5), decoder.parseFrame(buf(",-1.5\r\n")));
        assertEquals(RespBoolean.TRUE, decoder.parseFrame(buf("#t\r\n")));
        assertSame(RespNull.INSTANCE, decoder.parseFrame(buf("_\r\n")));
    }

    @Test
    public void testSetKeepsEveryElement() throws Exception {
        Frame frame = decoder.parseFrame(buf("~2\r\n$4\r\nping\r\n$4\r\npong\r\n"));
        assertEquals(RespSet.of(BulkString.of("ping"), BulkString.of("pong")), frame);
    }

    @Test
    public void testParseFrameRejectsTrailingBytes() {
        assertThrows(MalformedFrameException.class, () -> decoder.parseFrame(buf("+OK\r\n+x\r\n")));
    }

    @Test
    public void testParseFrameRejectsTruncatedSpan() {
        assertThrows(MalformedFrameException.class, () -> decoder.parseFrame(buf("*2\r\n:1\r\n")));
        assertThrows(MalformedFrameException.class, () -> decoder.parseFrame(buf("")));
    }

    @Test
    public void testMalformedScalarFailsInSecondPass() throws Exception {
        ByteBuf buf = buf(":abc\r\n");
        assertEquals(6, decoder.parseFrameLength(buf));
        assertThrows(MalformedFrameException.class, () -> decoder.decode(buf));
        assertEquals(0, buf.readerIndex());

        assertThrows(MalformedFrameException.class, () -> decoder.decode(buf("#x\r\n")));
        assertThrows(MalformedFrameException.class, () -> decoder.decode(buf("*1\r\n,1..2\r\n")));
    }

    @Test
    public void testDecodeConsumesExactlyOneFrame() throws Exception {
        ByteBuf buf = buf("*1\r\n$4\r\nping\r\n+OK\r\n$2\r\nhi");
        assertEquals(RespArray.of(BulkString.of("ping")), decoder.decode(buf));
        assertEquals(SimpleString.OK, decoder.decode(buf));
        int remaining = buf.readableBytes();
        assertThrows(NotCompleteException.class, () -> decoder.decode(buf));
        assertEquals(remaining, buf.readableBytes());
    }

    @Test
    public void testAgreesWithIncrementalDecoder() throws Exception {
        RespDecoder incremental = new RespDecoder();
        String[] samples = {
            "*2\r\n$3\r\nget\r\n$5\r\nhello\r\n",
            "%2\r\n+foo\r\n,-123456.789\r\n+hello\r\n$5\r\nworld\r\n",
            "~3\r\n_\r\n#t\r\n*-1\r\n",
            "*3\r\n$0\r\n\r\n$-1\r\n*0\r\n",
            "-ERR nope\r\n",
            ":-9223372036854775808\r\n",
        };
        for (String sample : samples) {
            ByteBuf a = buf(sample);
            ByteBuf b = buf(sample);
            assertEquals(incremental.expectLength(a), decoder.expectLength(b), sample);
            assertEquals(incremental.decode(a), decoder.decode(b), sample);
            assertEquals(a.readerIndex(), b.readerIndex(), sample);
        }
    }

    @Test
    public void testDeepNestingIsMalformedInBothPhases() {
        ByteBuf buf = buf(RespDecoderTest.nested(100000, ":1\r\n"));

        assertThrows(MalformedFrameException.class, () -> decoder.parseFrameLength(buf));
        assertThrows(MalformedFrameException.class, () -> decoder.decode(buf));
        assertEquals(0, buf.readerIndex());

        ByteBuf partial = buf(RespDecoderTest.nested(RespGrammar.MAX_DEPTH + 2, ""));
        assertThrows(MalformedFrameException.class, () -> decoder.decode(partial));
        assertEquals(0, partial.readerIndex());

        ByteBuf span = buf(RespDecoderTest.nested(RespGrammar.MAX_DEPTH + 1, "_\r\n"));
        assertThrows(MalformedFrameException.class, () -> decoder.parseFrame(span));
    }

    @Test
    public void testNestingAtLimitAgreesWithIncrementalDecoder() throws Exception {
        String wire = RespDecoderTest.nested(RespGrammar.MAX_DEPTH, "$2\r\nhi\r\n");

        assertEquals(wire.length(), decoder.parseFrameLength(buf(wire)));
        assertEquals(new RespDecoder().decode(buf(wire)), decoder.decode(buf(wire)));
    }
}
