package io.github.redlet.resp;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RespFramerTest {
    private RespFramer framer;

    @BeforeEach
    void beforeEach() {
        framer = RespFramer.create();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void decodeSimpleStringInPieces() {
        framer.decode(ByteBuffer.wrap(bytes("+OK\r")));
        assertNull(framer.get());

        framer.decode(ByteBuffer.wrap(bytes("\n")));
        RespSimpleString s = framer.get();
        assertNotNull(s);
        assertEquals("OK", s.getContent());
        assertNull(framer.get());
    }

    @Test
    void decodeBulkStringInPieces() {
        framer.decode(bytes("$6\r"));
        framer.decode(bytes("\nfoobar"));
        assertNull(framer.get());
        framer.decode(bytes("\r"));
        assertNull(framer.get());
        framer.decode(bytes("\n"));

        RespBulkString bs = framer.get();
        assertArrayEquals(bytes("foobar"), bs.getContent());
    }

    @Test
    void decodeArrayOneByteAtATime() {
        RespArray expected = RespArray.with(RespBulkString.withUTF8("SET"), RespBulkString.withUTF8("foo"),
                RespBulkString.withUTF8("bar"));
        byte[] bytes = expected.toBytes();
        for (int i = 0; i < bytes.length - 1; i++) {
            framer.decode(new byte[] {bytes[i]});
            assertNull(framer.get());
        }
        framer.decode(new byte[] {bytes[bytes.length - 1]});
        assertEquals(expected, framer.get());
        assertEquals(0, framer.pendingBytes());
    }

    @Test
    void pipelinedFramesComeOutInOrder() {
        framer.decode(bytes(":1\r\n:2\r\n*1\r\n$1\r\na\r\n:3"));

        assertEquals(RespInteger.with(1), framer.get());
        assertEquals(RespInteger.with(2), framer.get());
        assertEquals(RespArray.with(RespBulkString.withUTF8("a")), framer.get());
        assertNull(framer.get());
        assertEquals(2, framer.pendingBytes());

        framer.decode(bytes("\r\n"));
        assertEquals(RespInteger.with(3), framer.get());
    }

    @Test
    void compactsAcrossManyFrames() {
        for (int i = 0; i < 10000; i++) {
            framer.decode(RespInteger.with(i).toBytes());
            assertEquals(RespInteger.with(i), framer.get());
        }
        assertEquals(0, framer.pendingBytes());
    }

    @Test
    void protocolErrorPropagates() {
        framer.decode(bytes("!oops\r\n"));
        assertThrows(UnknownRespTypeException.class, () -> framer.get());
    }

    @Test
    void encode() {
        ByteBuffer bb = framer.encode(RespSimpleString.ok());
        byte[] dst = new byte[bb.remaining()];
        bb.get(dst);
        assertArrayEquals(bytes("+OK\r\n"), dst);
    }

    @Test
    void encodeConcatenatesInOrder() {
        ByteBuffer bb = framer.encode(Arrays.asList(RespSimpleString.ok(), RespInteger.with(1),
                RespBulkString.nullBulkString()));
        byte[] dst = new byte[bb.remaining()];
        bb.get(dst);
        assertArrayEquals(bytes("+OK\r\n:1\r\n$-1\r\n"), dst);
    }

    @Test
    void pendingDataIsBounded() {
        RespFramer small = new RespFramer(8);
        small.decode(bytes("$5\r\n"));
        assertNull(small.get());
        assertEquals(4, small.pendingBytes());
        assertThrows(MalformedRespException.class, () -> small.decode(bytes("abcde")));

        RespFramer other = new RespFramer(8);
        assertThrows(MalformedRespException.class, () -> other.decode(ByteBuffer.wrap(bytes("*1\r\n$3\r\nf"))));
    }

    @Test
    void consumedFramesDoNotCountAsPending() {
        RespFramer small = new RespFramer(8);
        small.decode(bytes("+OK\r\n"));
        assertEquals(RespSimpleString.ok(), small.get());
        small.decode(bytes("+OK\r\n"));
        assertEquals(RespSimpleString.ok(), small.get());
        assertEquals(0, small.pendingBytes());
    }
}
