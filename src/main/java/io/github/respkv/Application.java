package io.github.respkv;

import java.io.IOException;
import java.net.InetSocketAddress;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import io.github.respkv.kv.KeyValueServer;
import io.github.respkv.kv.MemoryStore;
import io.github.respkv.kv.Store;
import io.github.respkv.resp.RespParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 启动入口。通过系统属性配置：
 * <ul>
 *     <li>{@code listen}：监听地址，格式host:port，默认127.0.0.1:6379</li>
 *     <li>{@code maxBulkLength}：允许的最大bulk string字节数</li>
 * </ul>
 */
public class Application {
    private static final Logger logger = LoggerFactory.getLogger(Application.class);

    static final String DEFAULT_LISTEN = "127.0.0.1:6379";

    public static void main(String[] args) throws Exception {
        String prop = System.getProperty("listen", DEFAULT_LISTEN);
        InetSocketAddress listen = getInetSocketAddress(prop);

        prop = System.getProperty("maxBulkLength");
        int maxBulkLength = Strings.isNullOrEmpty(prop) ? RespParser.DEFAULT_MAX_BULK_LENGTH : Integer.parseInt(prop);

        Store store = new MemoryStore();
        KeyValueServer server = KeyValueServer.builder()
                .socketAddress(listen)
                .store(store)
                .maxBulkLength(maxBulkLength)
                .build();
        server.start();
        logger.info("kv server started, address: {}", server.getSocketAddress());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("kv server process exit.");
            try {
                server.shutdown();
            } catch (IOException e) {
                logger.warn("shutdown kv server failed.", e);
            }
        }));
    }

    public static InetSocketAddress getInetSocketAddress(String prop) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(prop), "address is empty");
        int i = prop.lastIndexOf(':');
        Preconditions.checkArgument(i > 0 && i < prop.length() - 1, "address must be host:port, got %s", prop);
        int port;
        try {
            port = Integer.parseInt(prop.substring(i + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port in " + prop, e);
        }
        Preconditions.checkArgument(port >= 0 && port <= 0xffff, "port out of range: %s", port);
        return new InetSocketAddress(prop.substring(0, i), port);
    }
}
