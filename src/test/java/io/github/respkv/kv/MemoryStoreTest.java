package io.github.respkv.kv;

import java.util.Optional;
import java.util.stream.Stream;

import io.github.respkv.resp.RespBulkString;
import io.github.respkv.resp.RespData;
import io.github.respkv.resp.RespInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MemoryStoreTest {
    private MemoryStore store;

    @BeforeEach
    void beforeEach() {
        store = new MemoryStore();
    }

    @Test
    void getMissing() {
        assertEquals(Optional.empty(), store.get("missing"));
        assertEquals(0, store.size());
    }

    @Test
    void putAndGet() {
        store.put("key", RespBulkString.withUTF8("value"));
        assertEquals(Optional.of(RespBulkString.withUTF8("value")), store.get("key"));
        assertEquals(1, store.size());
    }

    @Test
    void overwrite() {
        store.put("key", RespBulkString.withUTF8("value"));
        store.put("key", RespInteger.with(2));
        assertEquals(Optional.of(RespInteger.with(2)), store.get("key"));
        assertEquals(1, store.size());
    }

    @Test
    void nullKey() {
        assertThrows(NullPointerException.class, () -> store.put(null, RespInteger.with(1)));
        assertThrows(NullPointerException.class, () -> store.get(null));
    }

    @RepeatedTest(5)
    void concurrent() {
        Stream.iterate(0, (k) -> k + 1).limit(500).parallel()
                .forEach(n -> {
                    store.put("key" + n, RespBulkString.withUTF8("value" + n));
                    Optional<RespData> v = store.get("key" + n);
                    assertEquals(Optional.of(RespBulkString.withUTF8("value" + n)), v, "fail at " + n);
                });
        assertEquals(500, store.size());
    }
}
