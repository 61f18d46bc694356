package org.muma.minikv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RespCodecTest {

    private static ByteBuf buf(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    private static String encoded(RedisMessage msg) {
        return new String(RespCodec.encode(msg), StandardCharsets.UTF_8);
    }

    @Test
    void testDecodeLength() {
        Decoded<Long> len = RespCodec.decodeLength(buf("1234\r\n"));
        assertEquals(1234L, len.value());
        assertEquals(6, len.consumed());
    }

    @Test
    void testDecodeLengthRejectsGarbage() {
        assertThrows(RespProtocolException.class, () -> RespCodec.decodeLength(buf("12a\r\n")));
        assertThrows(RespProtocolException.class, () -> RespCodec.decodeLength(buf("-1\r\n")));
        assertThrows(RespProtocolException.class, () -> RespCodec.decodeLength(buf("\r\n")));
        // CR 之后必须是 LF
        assertThrows(RespProtocolException.class, () -> RespCodec.decodeLength(buf("3\rx")));
    }

    @Test
    void testDecodeLengthRejectsOversizedBulk() {
        assertThrows(RespProtocolException.class, () -> RespCodec.decodeLength(buf("99999999999\r\n")));
    }

    @Test
    void testDecodeSimpleString() {
        Decoded<String> s = RespCodec.decodeSimpleString(buf("+OK\r\n"));
        assertEquals("OK", s.value());
        assertEquals(5, s.consumed());
    }

    @Test
    void testDecodeError() {
        Decoded<String> e = RespCodec.decodeError(buf("-ERR boom\r\n"));
        assertEquals("ERR boom", e.value());
    }

    @Test
    void testDecodeBulkStringKeepsEmbeddedCrlf() {
        Decoded<String> s = RespCodec.decodeBulkString(buf("$4\r\na\r\nb\r\n"));
        assertEquals("a\r\nb", s.value());
        assertEquals(10, s.consumed());
    }

    @Test
    void testDecodeBulkStringWrongSigil() {
        assertThrows(RespProtocolException.class, () -> RespCodec.decodeBulkString(buf("+hi\r\n")));
    }

    @Test
    void testDecodeCommandConsumesExactFrame() {
        ByteBuf in = buf("*2\r\n$4\r\nECHO\r\n$3\r\nhey\r\n*1\r\n$4\r\nPING\r\n");
        CommandFrame first = RespCodec.decodeCommand(in);

        assertEquals(List.of("ECHO", "hey"), first.args());
        assertEquals(23, first.wireLength());
        assertEquals("ECHO", first.name());
        // 剩下的是第二个命令
        assertEquals(14, in.readableBytes());
        assertEquals(List.of("PING"), RespCodec.decodeCommand(in).args());
    }

    @Test
    void testEncodedCommandDecodesBack() {
        List<List<String>> commands = List.of(
                List.of(),
                List.of("PING"),
                List.of("SET", "", "value with spaces"),
                List.of("ECHO", "héllo wörld", "键值", "a\r\nb"),
                List.of("MSET", "k1", "v1", "k2", "v2", "k3", "v3", "k4", "v4"));

        for (List<String> parts : commands) {
            byte[] wire = RespCodec.encodeCommand(parts.toArray(new String[0]));
            ByteBuf in = Unpooled.wrappedBuffer(wire);

            CommandFrame frame = RespCodec.decodeCommand(in);

            assertEquals(parts, frame.args());
            assertEquals(wire.length, frame.wireLength());
            assertFalse(in.isReadable());
        }
    }

    @Test
    void testDecodeEmptyArray() {
        CommandFrame frame = RespCodec.decodeCommand(buf("*0\r\n"));
        assertTrue(frame.args().isEmpty());
        assertEquals(4, frame.wireLength());
        assertEquals("", frame.name());
    }

    @Test
    void testDecodeArrayRejectsNonBulkElements() {
        assertThrows(RespProtocolException.class, () -> RespCodec.decodeArray(buf("*1\r\n:5\r\n")));
    }

    @Test
    void testDecodeRdbPayloadHasNoTrailingCrlf() {
        ByteBuf in = buf("$3\r\nabc*1\r\n");
        Decoded<byte[]> rdb = RespCodec.decodeRdbPayload(in);
        assertArrayEquals("abc".getBytes(StandardCharsets.UTF_8), rdb.value());
        assertEquals(7, rdb.consumed());
        assertEquals('*', in.readByte());
    }

    @Test
    void testEncodeSimpleTypes() {
        assertEquals("+OK\r\n", encoded(SimpleString.OK));
        assertEquals("-ERR unknown command\r\n", encoded(new ErrorMessage("ERR unknown command")));
        assertEquals(":42\r\n", encoded(new RedisInteger(42)));
        assertEquals("$3\r\nbar\r\n", encoded(new BulkString("bar")));
        assertEquals("$-1\r\n", encoded(BulkString.NULL));
        assertEquals("$0\r\n\r\n", encoded(new BulkString("")));
    }

    @Test
    void testEncodeArray() {
        assertEquals("*2\r\n$1\r\na\r\n$1\r\nb\r\n", encoded(RedisArray.ofStrings("a", "b")));
        assertEquals("*0\r\n", encoded(RedisArray.ofStrings(List.of())));
        assertEquals("*-1\r\n", encoded(new RedisArray(null)));
    }

    @Test
    void testEncodeBulkLengthCountsBytesNotChars() {
        assertEquals("$2\r\né\r\n", encoded(new BulkString("é")));
    }

    @Test
    void testEncodeFullResync() {
        FullResync reply = new FullResync("abc", 0, new byte[]{'R', 'D', 'B'});
        assertEquals("+FULLRESYNC abc 0\r\n$3\r\nRDB", encoded(reply));
    }

    @Test
    void testEncodeCommand() {
        String wire = new String(RespCodec.encodeCommand("SET", "foo", "bar"), StandardCharsets.UTF_8);
        assertEquals("*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n", wire);
    }
}
