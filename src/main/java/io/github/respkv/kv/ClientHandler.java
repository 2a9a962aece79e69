package io.github.respkv.kv;

import java.io.IOException;
import java.nio.channels.SocketChannel;

import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespNone;
import io.github.respkv.resp.RespParser;
import io.github.respkv.resp.RespWriter;
import lombok.Builder;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 处理一个客户连接：循环解析请求，交给{@link CommandDispatcher}执行，再把响应写回。
 * 解析结果为{@link RespNone}时（对方关闭连接或者数据无法识别）结束循环并关闭连接。
 */
class ClientHandler implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ClientHandler.class);

    private final SocketChannel     clientChannel;
    private final CommandDispatcher dispatcher;
    private final RespParser        parser;
    private final RespWriter        writer;
    private final Runnable          onClose;

    @Builder
    ClientHandler(@NonNull SocketChannel clientChannel,
                  @NonNull CommandDispatcher dispatcher,
                  int maxBulkLength,
                  Runnable onClose) {
        this.clientChannel = clientChannel;
        this.dispatcher = dispatcher;
        this.parser = RespParser.create(clientChannel, maxBulkLength > 0 ? maxBulkLength : RespParser.DEFAULT_MAX_BULK_LENGTH);
        this.writer = RespWriter.with(clientChannel);
        this.onClose = onClose;
    }

    @Override
    public void run() {
        try {
            for (; ; ) {
                RespData request = parser.get();
                if (request instanceof RespNone) {
                    break;
                }
                RespData response = dispatcher.dispatch(request);
                try {
                    writer.append(response);
                } catch (IOException e) {
                    logger.debug("write response failed, drop it.", e);
                }
            }
        } catch (RuntimeException e) {
            logger.error("client handler exception.", e);
        } finally {
            close();
        }
    }

    private void close() {
        try {
            clientChannel.close();
        } catch (IOException e) {
            logger.warn("close client channel failed.", e);
        }
        if (onClose != null) {
            onClose.run();
        }
    }
}
