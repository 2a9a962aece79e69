package io.github.respkv.kv;

import java.util.Optional;

import io.github.respkv.resp.RespData;

/**
 * 所有连接共享的key-value存储，实现必须是线程安全的。
 */
public interface Store {
    void put(String key, RespData value);

    Optional<RespData> get(String key);

    int size();
}
