package io.github.redlet.kv;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.google.common.primitives.Bytes;
import io.github.redlet.resp.RespArray;
import io.github.redlet.resp.RespBulkString;
import io.github.redlet.resp.RespData;
import io.github.redlet.resp.RespError;
import io.github.redlet.resp.RespFramer;
import io.github.redlet.resp.RespInteger;
import io.github.redlet.resp.RespNull;
import io.github.redlet.resp.RespSimpleString;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeyValueServerTest {
    private static KeyValueServer    server;
    private static InetSocketAddress address;

    private SocketChannel client;
    private RespFramer    framer;

    @BeforeAll
    static void beforeAll() throws Exception {
        KeyValueEngine engine = KeyValueEngine.builder().store(new MemoryStore()).build();
        server = KeyValueServer.builder()
                .socketAddress(new InetSocketAddress("127.0.0.1", 0))
                .keyValueEngine(engine)
                .threads(4)
                .build();
        server.start();
        address = server.getLocalAddress();
    }

    @AfterAll
    static void afterAll() throws IOException {
        server.shutdown();
    }

    @BeforeEach
    void beforeEach() throws IOException {
        client = SocketChannel.open(address);
        framer = RespFramer.create();
    }

    @AfterEach
    void afterEach() throws IOException {
        client.close();
    }

    @Test
    void setThenGet() throws IOException {
        sendReq(client, "SET", "server-foo", "bar");
        assertEquals(RespSimpleString.ok(), receiveResp(client, framer));

        sendReq(client, "GET", "server-foo");
        assertEquals(RespBulkString.withUTF8("bar"), receiveResp(client, framer));

        sendReq(client, "GET", "server-missing");
        assertEquals(RespNull.instance(), receiveResp(client, framer));
    }

    @Test
    void pipelinedRepliesKeepOrder() throws IOException {
        byte[] batch = Bytes.concat(
                request("SADD", "server-set", "one").toBytes(),
                request("SADD", "server-set", "one").toBytes(),
                request("SADD", "server-set", "two", "three").toBytes(),
                request("SMEMBERS", "server-set").toBytes());
        write(client, batch);

        assertEquals(RespInteger.with(1), receiveResp(client, framer));
        assertEquals(RespInteger.with(0), receiveResp(client, framer));
        assertEquals(RespInteger.with(2), receiveResp(client, framer));
        assertEquals(RespArray.with(RespBulkString.withUTF8("one"), RespBulkString.withUTF8("two"),
                RespBulkString.withUTF8("three")), receiveResp(client, framer));
    }

    @Test
    void requestSplitAcrossWrites() throws Exception {
        byte[] bytes = request("ECHO", "a somewhat longer message").toBytes();
        for (byte b : bytes) {
            write(client, new byte[] {b});
        }
        assertEquals(RespBulkString.withUTF8("a somewhat longer message"), receiveResp(client, framer));
    }

    @Test
    void largeValue() throws IOException {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 20000; i++) {
            sb.append(i % 10);
        }
        sendReq(client, "SET", "server-large", sb.toString());
        assertEquals(RespSimpleString.ok(), receiveResp(client, framer));
        sendReq(client, "GET", "server-large");
        assertEquals(RespBulkString.withUTF8(sb.toString()), receiveResp(client, framer));
    }

    @Test
    void unknownCommandKeepsConnection() throws IOException {
        sendReq(client, "FOO", "bar");
        assertEquals(RespSimpleString.ok(), receiveResp(client, framer));

        sendReq(client, "ECHO", "still here");
        assertEquals(RespBulkString.withUTF8("still here"), receiveResp(client, framer));
    }

    @Test
    void commandErrorKeepsConnection() throws IOException {
        sendReq(client, "HSET", "server-h", "f");
        RespError error = (RespError) receiveResp(client, framer);
        assertTrue(error.getContent().startsWith("ERR hset"));

        sendReq(client, "HSET", "server-h", "f", "v");
        assertEquals(RespSimpleString.ok(), receiveResp(client, framer));
    }

    @Test
    void protocolErrorClosesConnection() throws IOException {
        write(client, "!garbage\r\n".getBytes(StandardCharsets.US_ASCII));
        ByteBuffer dst = ByteBuffer.allocate(64);
        int len;
        do {
            dst.clear();
            len = client.read(dst);
        } while (len > 0);
        assertEquals(-1, len);
    }

    @Test
    void repliesBeforeProtocolErrorAreSent() throws IOException {
        write(client, Bytes.concat(request("ECHO", "first").toBytes(), "!garbage\r\n".getBytes(StandardCharsets.US_ASCII)));
        assertEquals(RespBulkString.withUTF8("first"), receiveResp(client, framer));
    }

    @Test
    void concurrentClientsShareStore() throws Exception {
        ExecutorService executorService = Executors.newFixedThreadPool(8);
        try {
            List<Future<Long>> futures = new ArrayList<>();
            for (int c = 0; c < 8; c++) {
                futures.add(executorService.submit(() -> {
                    long added = 0;
                    try (SocketChannel channel = SocketChannel.open(address)) {
                        RespFramer f = RespFramer.create();
                        for (int i = 0; i < 50; i++) {
                            sendReq(channel, "SADD", "server-shared", String.valueOf(i));
                            RespInteger n = (RespInteger) receiveResp(channel, f);
                            added += n.getN();
                        }
                    }
                    return added;
                }));
            }
            long total = 0;
            for (Future<Long> future : futures) {
                total += future.get();
            }
            assertEquals(50, total);
        } finally {
            executorService.shutdownNow();
        }

        sendReq(client, "SMEMBERS", "server-shared");
        assertEquals(50, ((RespArray) receiveResp(client, framer)).size());
    }

    private static RespArray request(String cmd, String... args) {
        List<RespData> datas = new ArrayList<>();
        datas.add(RespBulkString.withUTF8(cmd));
        for (String arg : args) {
            datas.add(RespBulkString.withUTF8(arg));
        }
        return RespArray.with(datas);
    }

    private static void sendReq(SocketChannel channel, String cmd, String... args) throws IOException {
        write(channel, request(cmd, args).toBytes());
    }

    private static void write(SocketChannel channel, byte[] bytes) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        while (buf.hasRemaining()) {
            channel.write(buf);
        }
    }

    private static RespData receiveResp(SocketChannel channel, RespFramer framer) throws IOException {
        RespData resp = framer.get();
        if (resp != null) {
            return resp;
        }
        ByteBuffer dst = ByteBuffer.allocate(10);
        int len = channel.read(dst);
        while (len != -1) {
            dst.flip();
            framer.decode(dst);
            resp = framer.get();
            if (resp != null) {
                return resp;
            }
            dst.clear();
            len = channel.read(dst);
        }
        throw new IllegalStateException("connection closed");
    }
}
