package io.github.redlet.kv;

import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.CompletionHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 写回调。一次写不完时继续写剩余部分，全部写完后交回{@link ReadHandler}读下一批请求。
 */
class WriteHandler implements CompletionHandler<Integer, KeyValueEngine> {
    private static final Logger logger = LoggerFactory.getLogger(WriteHandler.class);

    private final ReadHandler readHandler;
    private final ByteBuffer  byteBuffer;
    // 协议错误前的响应写完后关闭连接
    private final boolean     closeAfterWrite;

    WriteHandler(ReadHandler readHandler, ByteBuffer byteBuffer, boolean closeAfterWrite) {
        this.readHandler = readHandler;
        this.byteBuffer = byteBuffer;
        this.closeAfterWrite = closeAfterWrite;
    }

    @Override
    public void completed(Integer result, KeyValueEngine engine) {
        if (byteBuffer.hasRemaining()) {
            readHandler.getChannel().write(byteBuffer, engine, this);
            return;
        }
        if (closeAfterWrite) {
            readHandler.close();
            return;
        }
        readHandler.getChannel().read(readHandler.getByteBuffer(), engine, readHandler);
    }

    @Override
    public void failed(Throwable exc, KeyValueEngine engine) {
        if (exc instanceof ClosedChannelException) {
            logger.debug("connection closed before write finished.");
        } else {
            logger.error("kv server in write failed.", exc);
        }
        readHandler.close();
    }
}
