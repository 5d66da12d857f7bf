package io.github.redlet.kv;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.AsynchronousChannelGroup;
import java.nio.channels.AsynchronousServerSocketChannel;
import java.nio.channels.AsynchronousSocketChannel;
import java.nio.channels.CompletionHandler;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 使用java nio监听指定端口，每个连接由一个{@link ReadHandler}完成redis resp协议解析，
 * 使用{@link KeyValueEngine}处理，再由{@link WriteHandler}返回响应。
 *
 * @author zy
 */
public class KeyValueServer {
    private static final Logger logger = LoggerFactory.getLogger(KeyValueServer.class);

    static final int DEFAULT_THREADS = 20;

    // 服务地址
    @Getter(AccessLevel.PACKAGE)
    private final InetSocketAddress               socketAddress;
    // kv处理引擎
    private final KeyValueEngine                  engine;
    // io线程数
    private final int                             threads;
    // 服务socket channel
    private       AsynchronousServerSocketChannel serverSocketChannel;
    // 处理线程池，accept和读写回调都在这里执行
    private       AsynchronousChannelGroup        channelGroup;

    @Builder
    public KeyValueServer(@NonNull InetSocketAddress socketAddress,
                          @NonNull KeyValueEngine keyValueEngine,
                          int threads) {
        Preconditions.checkArgument(threads >= 0, "threads must not be negative");
        this.socketAddress = socketAddress;
        this.engine = keyValueEngine;
        this.threads = threads == 0 ? DEFAULT_THREADS : threads;
    }

    /**
     * 启动服务
     *
     * @throws IOException 绑定地址失败
     */
    public void start() throws IOException {
        channelGroup = AsynchronousChannelGroup.withFixedThreadPool(threads,
                new ThreadFactoryBuilder().setNameFormat("redlet-io-%d").build());
        serverSocketChannel = AsynchronousServerSocketChannel.open(channelGroup);
        serverSocketChannel.bind(socketAddress);
        serverSocketChannel.accept(engine, new CompletionHandler<AsynchronousSocketChannel, KeyValueEngine>() {
            @Override
            public void completed(AsynchronousSocketChannel channel, KeyValueEngine engine) {
                if (serverSocketChannel.isOpen()) {
                    serverSocketChannel.accept(engine, this);
                }
                ReadHandler readHandler = new ReadHandler(channel);
                logger.debug("accepted connection {}", readHandler.getRemoteAddress());
                channel.read(readHandler.getByteBuffer(), engine, readHandler);
            }

            @Override
            public void failed(Throwable exc, KeyValueEngine engine) {
                if (!serverSocketChannel.isOpen()) {
                    return;
                }
                logger.error("kv server accept failed.", exc);
                serverSocketChannel.accept(engine, this);
            }
        });
        logger.info("kv server listening on {} with {} io threads", getLocalAddress(), threads);
    }

    /**
     * @return 实际绑定的地址，端口为0时由系统分配
     * @throws IOException 获取地址失败
     */
    public InetSocketAddress getLocalAddress() throws IOException {
        Preconditions.checkState(serverSocketChannel != null, "kv server not started");
        return (InetSocketAddress) serverSocketChannel.getLocalAddress();
    }

    /**
     * 关闭服务，已经建立的连接一起关闭
     *
     * @throws IOException 关闭异常
     */
    public void shutdown() throws IOException {
        if (serverSocketChannel != null) {
            serverSocketChannel.close();
        }
        if (channelGroup != null) {
            channelGroup.shutdownNow();
        }
        logger.info("kv server shutdown.");
    }
}
