package io.github.redlet;

import java.io.IOException;

import io.github.redlet.kv.KeyValueEngine;
import io.github.redlet.kv.KeyValueServer;
import io.github.redlet.kv.MemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Application {
    private static final Logger logger = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) throws Exception {
        ServerConf conf = ServerConf.fromProperties(System.getProperties());
        logger.info("starting with {}", conf);

        KeyValueEngine keyValueEngine = KeyValueEngine.builder()
                .store(new MemoryStore())
                .build();

        KeyValueServer server = KeyValueServer.builder()
                .socketAddress(conf.getSocketAddress())
                .keyValueEngine(keyValueEngine)
                .threads(conf.getThreads())
                .build();
        server.start();
        logger.info("本地kv服务启动成功，地址：{}", server.getLocalAddress());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("服务进程退出.");
            try {
                server.shutdown();
            } catch (IOException e) {
                logger.error("kv server shutdown failed.", e);
            }
        }));
    }
}
