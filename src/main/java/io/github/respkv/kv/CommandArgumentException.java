package io.github.respkv.kv;

/**
 * 命令缺少参数或参数无法处理。
 */
public class CommandArgumentException extends RuntimeException {
    private static final long serialVersionUID = 4471828390214783522L;

    public CommandArgumentException(String message) {
        super(message);
    }
}
