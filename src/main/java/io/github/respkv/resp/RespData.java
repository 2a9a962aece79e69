package io.github.respkv.resp;

import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.List;

/**
 * RESP协议中的一个数据单元。实现类都是不可变对象，可以在多个连接之间共享。
 */
public interface RespData {

    /**
     * @return 该数据在网络上传输的完整字节
     */
    byte[] toBytes();

    default ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(toBytes());
    }

    /**
     * 数据的文本形式，用作命令参数和存储的key。
     * @return 文本形式
     */
    String textualForm();

    /**
     * 把数组展开成叶子节点文本的列表，嵌套数组原地展开。非数组返回空列表。
     * @return 叶子节点的文本形式
     */
    default List<String> flatten() {
        return Collections.emptyList();
    }
}
