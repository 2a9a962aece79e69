package io.github.respkv.resp;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;

import lombok.NonNull;

/**
 * 把RESP数据完整写入channel。
 */
public class RespWriter {
    private final WritableByteChannel byteChannel;

    public static RespWriter with(WritableByteChannel byteChannel) {
        return new RespWriter(byteChannel);
    }

    private RespWriter(@NonNull WritableByteChannel byteChannel) {
        this.byteChannel = byteChannel;
    }

    public void append(RespData respData) throws IOException {
        write(respData.toByteBuffer());
    }

    public void append(RespData... respDatas) throws IOException {
        for (RespData respData : respDatas) {
            write(respData.toByteBuffer());
        }
    }

    private void write(ByteBuffer src) throws IOException {
        while (src.hasRemaining()) {
            byteChannel.write(src);
        }
    }
}
