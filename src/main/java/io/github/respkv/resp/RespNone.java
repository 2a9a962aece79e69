package io.github.respkv.resp;

/**
 * 表示没有解码出任何数据：连接已关闭，或者遇到无法识别的类型前缀。
 * 只作为{@link RespParser#get()}的结果出现，不会出现在{@link RespArray}中，编码为空。
 */
public final class RespNone implements RespData {
    private static final RespNone NONE  = new RespNone();
    private static final byte[]   EMPTY = new byte[0];

    public static RespNone none() {
        return NONE;
    }

    private RespNone() {
    }

    @Override
    public byte[] toBytes() {
        return EMPTY;
    }

    @Override
    public String textualForm() {
        return "";
    }

    @Override
    public String toString() {
        return "RespNone";
    }
}
