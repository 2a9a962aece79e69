package io.github.respkv.resp;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.base.Utf8;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 从阻塞的channel中逐个解析RESP数据，每次调用{@link #get()}返回一个完整的数据，数组递归解析。
 * <p>
 * 解析是宽松的：无法解析的整数和长度当作0；遇到未知的类型前缀、channel关闭或读取异常时返回{@link RespNone}，
 * 调用方据此结束连接。每个类型前缀之前的空行（单独的\r\n）会被跳过，所以数组元素后面多带一个\r\n也能正确解析。
 */
public class RespParser {
    private static final Logger logger = LoggerFactory.getLogger(RespParser.class);

    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;
    static final        int MAX_NESTING             = 512;

    private final ReadableByteChannel channel;
    private final ByteBuffer          bb;
    @Getter
    private final int                 maxBulkLength;
    @Getter
    private       boolean             endOfStream = false;

    public static RespParser create(ReadableByteChannel channel) {
        return new RespParser(channel, DEFAULT_MAX_BULK_LENGTH);
    }

    public static RespParser create(ReadableByteChannel channel, int maxBulkLength) {
        return new RespParser(channel, maxBulkLength);
    }

    private RespParser(@NonNull ReadableByteChannel channel, int maxBulkLength) {
        Preconditions.checkArgument(maxBulkLength >= 0, "maxBulkLength不能小于0");
        this.channel = channel;
        this.maxBulkLength = maxBulkLength;
        this.bb = ByteBuffer.allocate(5120);
        bb.flip();
    }

    /**
     * 解析下一个数据，数据不完整时阻塞等待。
     *
     * @return 解析出的数据，连接关闭或格式无法识别时返回{@link RespNone}
     */
    public RespData get() {
        return get(0);
    }

    private RespData get(int depth) {
        int firstByte = readTypeByte();
        if (firstByte == -1) {
            return RespNone.none();
        }

        switch (firstByte) {
            case RespSimpleString.firstChar:
                return RespSimpleString.withUTF8(stripForSimpleString(readLine()));
            case RespError.firstChar:
                return RespError.withUTF8(stripForSimpleString(readLine()));
            case RespInteger.firstChar:
                return RespInteger.parse(readLine());
            case RespBulkString.firstChar:
                return getAsBulkString();
            case RespArray.firstChar:
                return getAsArray(depth);
            default:
                logger.debug("unknown resp type byte: {}", firstByte);
                return RespNone.none();
        }
    }

    private RespData getAsBulkString() {
        String line = readLine();
        if ("-1".equals(line)) {
            return RespBulkString.nullBulkString();
        }

        long len = Math.max(RespInteger.parseLong(line, 0L), 0L);
        if (len > maxBulkLength) {
            logger.debug("bulk string length {} exceeds {}", len, maxBulkLength);
            return RespNone.none();
        }

        // 按实际到达的数据增长，不按声明的长度预先分配
        ByteArrayOutputStream os = new ByteArrayOutputStream((int) Math.min(len, bb.capacity()));
        if (!readFully(os, (int) len)) {
            logger.debug("stream ended inside bulk string body.");
            return RespNone.none();
        }
        byte[] bytes = os.toByteArray();
        if (!Utf8.isWellFormed(bytes)) {
            logger.debug("bulk string is not valid utf-8.");
            return RespNone.none();
        }

        RespBulkString bs = RespBulkString.with(bytes);
        int cr = readByte();
        if (cr == -1) {
            return bs;
        }
        int lf = readByte();
        if (cr != '\r' || (lf != '\n' && lf != -1)) {
            logger.debug("bulk string is not terminated by \\r\\n.");
            return RespNone.none();
        }
        return bs;
    }

    private RespData getAsArray(int depth) {
        if (depth >= MAX_NESTING) {
            logger.debug("resp array nested deeper than {}", MAX_NESTING);
            return RespNone.none();
        }
        long len = Math.max(RespInteger.parseLong(readLine(), 0L), 0L);

        List<RespData> datas = new ArrayList<>();
        while (len > 0) {
            RespData data = get(depth + 1);
            if (data instanceof RespNone) {
                return data;
            }
            datas.add(data);
            len--;
        }
        return RespArray.with(datas);
    }

    /**
     * 跳过前面的空行，读取类型字节。
     */
    private int readTypeByte() {
        for (; ; ) {
            int b = readByte();
            if (b == '\r' && peekByte() == '\n') {
                readByte();
                continue;
            }
            return b;
        }
    }

    /**
     * 读取到\r\n为止的内容，不包含\r\n。流结束时返回已经读到的部分。
     */
    String readLine() {
        ByteArrayOutputStream os = new ByteArrayOutputStream();
        for (; ; ) {
            int b = readByte();
            if (b == -1) {
                break;
            }
            if (b == '\r' && peekByte() == '\n') {
                readByte();
                break;
            }
            os.write(b);
        }
        return new String(os.toByteArray(), StandardCharsets.UTF_8);
    }

    // 行中单独出现的\r或\n无法放进simple string
    private String stripForSimpleString(String line) {
        return line.indexOf('\r') < 0 && line.indexOf('\n') < 0 ? line : line.replace("\r", "").replace("\n", "");
    }

    private boolean readFully(ByteArrayOutputStream os, int len) {
        while (len > 0) {
            if (!readBytesIfNotHasRemaining()) {
                return false;
            }
            int n = Math.min(bb.remaining(), len);
            os.write(bb.array(), bb.arrayOffset() + bb.position(), n);
            bb.position(bb.position() + n);
            len -= n;
        }
        return true;
    }

    private int readByte() {
        if (!readBytesIfNotHasRemaining()) {
            return -1;
        }
        return bb.get() & 0xff;
    }

    private int peekByte() {
        if (!readBytesIfNotHasRemaining()) {
            return -1;
        }
        return bb.get(bb.position()) & 0xff;
    }

    /**
     * @return false 没有更多数据
     */
    private boolean readBytesIfNotHasRemaining() {
        if (bb.hasRemaining()) {
            return true;
        }
        if (endOfStream) {
            return false;
        }

        bb.clear();
        try {
            int read;
            do {
                read = channel.read(bb);
            } while (read == 0);

            if (read == -1) {
                endOfStream = true;
            }
        } catch (IOException e) {
            logger.debug("read channel failed, treat as end of stream.", e);
            endOfStream = true;
        } finally {
            bb.flip();
        }
        return bb.hasRemaining();
    }
}
