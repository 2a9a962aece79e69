package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 64位有符号整数。
 */
@EqualsAndHashCode
@ToString
public class RespInteger implements RespData {
    static final char firstChar = ':';
    @Getter
    private final long n;

    public static RespInteger with(long n) {
        return new RespInteger(n);
    }

    /**
     * 按RESP的宽松规则解析整数，无法解析时当作0。
     * @param s 整数文本
     * @return 整数
     */
    public static RespInteger parse(String s) {
        return new RespInteger(parseLong(s, 0L));
    }

    static long parseLong(String s, long defaultValue) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private RespInteger(long n) {
        this.n = n;
    }

    @Override
    public String textualForm() {
        return Long.toString(n);
    }

    @Override
    public byte[] toBytes() {
        return (firstChar + Long.toString(n) + "\r\n").getBytes(StandardCharsets.US_ASCII);
    }
}
