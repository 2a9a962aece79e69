package io.github.respkv.kv;

import java.util.List;

import io.github.respkv.resp.RespArray;
import io.github.respkv.resp.RespBulkString;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespError;
import io.github.respkv.resp.RespSimpleString;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 解释客户端发来的命令并读写{@link Store}。
 * <p>
 * 命令名大小写敏感：{@code ECHO}、{@code PING}是大写，{@code set}、{@code get}是小写，未知命令一律返回OK。
 */
public class CommandDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    static final String ECHO_CMD = "ECHO";
    static final String PING_CMD = "PING";
    static final String SET_CMD  = "set";
    static final String GET_CMD  = "get";

    static final RespSimpleString OK     = RespSimpleString.withUTF8("OK");
    static final RespSimpleString PONG   = RespSimpleString.withUTF8("PONG");
    static final RespSimpleString CHEESE = RespSimpleString.withUTF8("CHEESE");

    private final Store store;

    public CommandDispatcher(@NonNull Store store) {
        this.store = store;
    }

    /**
     * 执行一个请求。参数错误转换成{@link RespError}，不会抛出异常。
     *
     * @param request 解析出的请求
     * @return 响应
     */
    public RespData dispatch(@NonNull RespData request) {
        if (!(request instanceof RespArray)) {
            return OK;
        }
        try {
            return execute((RespArray) request);
        } catch (CommandArgumentException e) {
            logger.debug("bad command {}: {}", request, e.getMessage());
            return RespError.withUTF8("ERR " + e.getMessage());
        }
    }

    private RespData execute(RespArray request) {
        List<String> cmd = request.flatten();
        if (cmd.isEmpty()) {
            throw new CommandArgumentException("empty command");
        }

        switch (cmd.get(0)) {
            case ECHO_CMD:
                checkArity(ECHO_CMD, cmd.size(), 2);
                return echo(cmd.get(1));
            case PING_CMD:
                return PONG;
            case SET_CMD:
                checkArity(SET_CMD, request.size(), 3);
                store.put(request.get(1).textualForm(), request.get(2));
                return CHEESE;
            case GET_CMD:
                checkArity(GET_CMD, request.size(), 2);
                return store.get(request.get(1).textualForm()).orElse(RespBulkString.nullBulkString());
            default:
                return OK;
        }
    }

    private RespData echo(String message) {
        if (message.indexOf('\r') >= 0 || message.indexOf('\n') >= 0) {
            throw new CommandArgumentException("ECHO argument can't contain \\r or \\n");
        }
        return RespSimpleString.withUTF8(message);
    }

    private static void checkArity(String cmd, int actual, int required) {
        if (actual < required) {
            throw new CommandArgumentException("wrong number of arguments for '" + cmd + "' command");
        }
    }
}
