package io.github.respkv.kv;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.respkv.resp.RespParser;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 阻塞方式监听指定地址，每个连接交给一个线程上的{@link ClientHandler}处理，所有连接共享同一个{@link Store}。
 */
public class KeyValueServer implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(KeyValueServer.class);

    static final     long                ACCEPT_RETRY_DELAY_MS = 100;

    private final    InetSocketAddress   me;
    private final    CommandDispatcher   dispatcher;
    private final    int                 maxBulkLength;
    private final    Set<SocketChannel>  clients = ConcurrentHashMap.newKeySet();
    private volatile boolean             started = false;
    private volatile ServerSocketChannel ssc;
    private volatile Thread              acceptThread;
    private volatile ExecutorService     executorService;
    // 绑定后的实际地址，端口为0时由系统分配
    @Getter
    private volatile InetSocketAddress   socketAddress;

    @Builder
    public KeyValueServer(@NonNull InetSocketAddress socketAddress, @NonNull Store store, int maxBulkLength) {
        this.me = socketAddress;
        this.socketAddress = socketAddress;
        this.dispatcher = new CommandDispatcher(store);
        this.maxBulkLength = maxBulkLength > 0 ? maxBulkLength : RespParser.DEFAULT_MAX_BULK_LENGTH;
    }

    /**
     * 启动服务，地址绑定失败时抛出异常。
     *
     * @throws IOException 绑定失败
     */
    public synchronized void start() throws IOException {
        if (started) {
            throw new IllegalStateException("kv server already started.");
        }
        ssc = ServerSocketChannel.open();
        try {
            ssc.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            ssc.configureBlocking(true);
            ssc.bind(me);
        } catch (IOException e) {
            ssc.close();
            throw e;
        }
        socketAddress = (InetSocketAddress) ssc.getLocalAddress();

        executorService = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder().setNameFormat("respkv-client-%d").build());
        started = true;
        acceptThread = new Thread(this, "respkv-accept");
        acceptThread.start();
        logger.info("kv server listening on {}", socketAddress);
    }

    /**
     * 关闭服务和所有客户连接。
     *
     * @throws IOException 关闭异常
     */
    public synchronized void shutdown() throws IOException {
        if (!started) {
            return;
        }
        started = false;
        ssc.close();
        acceptThread.interrupt();
        for (SocketChannel c : clients) {
            closeQuietly(c);
        }
        clients.clear();
        executorService.shutdown();
        logger.info("kv server on {} shut down.", socketAddress);
    }

    public boolean isStarted() {
        return started;
    }

    int connections() {
        return clients.size();
    }

    @Override
    public void run() {
        while (started) {
            SocketChannel cc;
            try {
                cc = ssc.accept();
            } catch (ClosedChannelException e) {
                break;
            } catch (IOException e) {
                logger.error("kv server accept failed.", e);
                if (!pauseAfterAcceptFailure()) {
                    break;
                }
                continue;
            }

            addClient(cc);
            ClientHandler handler = ClientHandler.builder()
                    .clientChannel(cc)
                    .dispatcher(dispatcher)
                    .maxBulkLength(maxBulkLength)
                    .onClose(() -> clients.remove(cc))
                    .build();
            try {
                executorService.execute(handler);
            } catch (RejectedExecutionException e) {
                logger.warn("kv server is shutting down, reject connection.");
                closeQuietly(cc);
            }
        }
    }

    void addClient(SocketChannel cc) {
        clients.add(cc);
    }

    /**
     * accept失败（例如文件句柄耗尽）后暂停一段时间再重试。
     *
     * @return false 等待时被中断
     */
    boolean pauseAfterAcceptFailure() {
        try {
            TimeUnit.MILLISECONDS.sleep(ACCEPT_RETRY_DELAY_MS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void closeQuietly(SocketChannel cc) {
        clients.remove(cc);
        try {
            cc.close();
        } catch (IOException e) {
            logger.warn("close client channel failed.", e);
        }
    }
}
