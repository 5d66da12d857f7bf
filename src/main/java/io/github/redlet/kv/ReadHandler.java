package io.github.redlet.kv;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.CompletionHandler;
import java.util.ArrayList;
import java.util.List;


import io.github.redlet.resp.RespData;
import io.github.redlet.resp.RespException;
import io.github.redlet.resp.RespFramer;
import lombok.AccessLevel;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 一个连接的读回调。每次读到数据后，处理缓冲区中所有完整的请求，把响应按请求顺序拼在一起一次写出，
 * 写完后再发起下一次读。同一时刻一个连接上最多只有一个读或写。
 *
 * @author zy
 */
class ReadHandler implements CompletionHandler<Integer, KeyValueEngine> {
    private static final Logger logger = LoggerFactory.getLogger(ReadHandler.class);
    @Getter(value = AccessLevel.PACKAGE)
    private final AsynchronousSocketChannel channel;
    @Getter(value = AccessLevel.PACKAGE)
    private final ByteBuffer                byteBuffer = ByteBuffer.allocate(2048);
    private final RespFramer                framer     = RespFramer.create();

    ReadHandler(AsynchronousSocketChannel channel) {
        this.channel = channel;
    }

    @Override
    public void completed(Integer result, KeyValueEngine engine) {
        if (result == -1) {
            logger.debug("connection {} closed by peer.", getRemoteAddress());
            close();
            return;
        }

        List<RespData> replies = new ArrayList<>();
        boolean closeAfterWrite = false;
        try {
            byteBuffer.flip();
            framer.decode(byteBuffer);
            RespData request;
            while ((request = framer.get()) != null) {
                logger.debug("request from {}: {}", getRemoteAddress(), request);
                replies.add(engine.execute(request));
            }
        } catch (RespException e) {
            logger.warn("close connection {} on protocol error: {}", getRemoteAddress(), e.getMessage());
            closeAfterWrite = true;
        } finally {
            byteBuffer.clear();
        }

        if (replies.isEmpty()) {
            if (closeAfterWrite) {
                close();
            } else {
                channel.read(byteBuffer, engine, this);
            }
            return;
        }
        ByteBuffer bb = framer.encode(replies);
        channel.write(bb, engine, new WriteHandler(this, bb, closeAfterWrite));
    }

    @Override
    public void failed(Throwable exc, KeyValueEngine engine) {
        if (exc instanceof ClosedChannelException) {
            logger.debug("connection {} already closed.", getRemoteAddress());
        } else {
            logger.error("kv server channel failed.", exc);
        }
        close();
    }

    SocketAddress getRemoteAddress() {
        try {
            return channel.getRemoteAddress();
        } catch (IOException e) {
            // 只用于日志
            return null;
        }
    }

    void close() {
        try {
            channel.close();
        } catch (IOException e) {
            logger.error("close channel failed.", e);
        }
    }
}
