package io.github.respkv.kv;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import io.github.respkv.resp.RespData;
import lombok.NonNull;

/**
 * 内存中的存储，读写锁保护：get可以并发，put独占。每次加锁只覆盖一次插入或查找。
 * {@link RespData}是不可变的，查到的值在锁外编码。
 */
public class MemoryStore implements Store {
    private final Map<String, RespData> map           = new HashMap<>();
    private final ReadWriteLock         readWriteLock = new ReentrantReadWriteLock();

    @Override
    public void put(@NonNull String key, @NonNull RespData value) {
        readWriteLock.writeLock().lock();
        try {
            map.put(key, value);
        } finally {
            readWriteLock.writeLock().unlock();
        }
    }

    @Override
    public Optional<RespData> get(@NonNull String key) {
        readWriteLock.readLock().lock();
        try {
            return Optional.ofNullable(map.get(key));
        } finally {
            readWriteLock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        readWriteLock.readLock().lock();
        try {
            return map.size();
        } finally {
            readWriteLock.readLock().unlock();
        }
    }
}
