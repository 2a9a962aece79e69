package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import com.google.common.primitives.Bytes;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 二进制安全的字符串，content为null时表示null bulk string（{@code $-1}）。
 */
@EqualsAndHashCode
@ToString
public final class RespBulkString implements RespData {
    public static final char firstChar = '$';

    private final static RespBulkString NULL = new RespBulkString(null);
    @Getter
    private final        int            length;
    private final        byte[]         content;

    public static RespBulkString with(byte[] content) {
        return new RespBulkString(content);
    }

    public static RespBulkString withUTF8(String content) {
        return new RespBulkString(content.getBytes(StandardCharsets.UTF_8));
    }

    public static RespBulkString nullBulkString() {
        return NULL;
    }

    private RespBulkString(byte[] content) {
        if (content == null) {
            this.content = null;
            this.length = -1;
        } else {
            this.content = Arrays.copyOf(content, content.length);
            this.length = content.length;
        }
    }

    public boolean isNull() {
        return content == null;
    }

    public byte[] getContent() {
        return content == null ? null : Arrays.copyOf(content, content.length);
    }

    @Override
    public String textualForm() {
        return content == null ? "" : new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public byte[] toBytes() {
        StringBuilder sb = new StringBuilder();
        sb.append(firstChar);
        sb.append(length);
        sb.append("\r\n");
        byte[] bytes = sb.toString().getBytes(StandardCharsets.US_ASCII);

        if (this.content != null) {
            bytes = Bytes.concat(bytes, content, "\r\n".getBytes(StandardCharsets.US_ASCII));
        }
        return bytes;
    }
}
