package io.github.respkv.resp;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RespDataTest {

    @Test
    void simpleStringToBytes() {
        byte[] s = RespSimpleString.withUTF8("OK").toBytes();
        assertArrayEquals("+OK\r\n".getBytes(), s);
    }

    @Test
    void simpleStringRejectsLineBreak() {
        assertThrows(IllegalArgumentException.class, () -> RespSimpleString.withUTF8("a\r\nb"));
        assertThrows(IllegalArgumentException.class, () -> RespError.withUTF8("a\nb"));
    }

    @Test
    void errorToBytes() {
        assertArrayEquals("-ERR boom\r\n".getBytes(), RespError.withUTF8("ERR boom").toBytes());
    }

    @Test
    void integerToBytes() {
        assertArrayEquals(":0\r\n".getBytes(), RespInteger.with(0).toBytes());
        assertArrayEquals(":1000\r\n".getBytes(), RespInteger.with(1000).toBytes());
        assertArrayEquals(":-42\r\n".getBytes(), RespInteger.with(-42).toBytes());
        assertArrayEquals((":" + Long.MIN_VALUE + "\r\n").getBytes(), RespInteger.with(Long.MIN_VALUE).toBytes());
    }

    @Test
    void bulkStringToBytes() {
        assertArrayEquals("$6\r\nfoobar\r\n".getBytes(), RespBulkString.withUTF8("foobar").toBytes());
        assertArrayEquals("$0\r\n\r\n".getBytes(), RespBulkString.withUTF8("").toBytes());
    }

    @Test
    void bulkStringLengthCountsBytes() {
        RespBulkString bs = RespBulkString.withUTF8("测试");
        assertEquals(6, bs.getLength());
        byte[] expected = "$6\r\n测试\r\n".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(expected, bs.toBytes());
    }

    @Test
    void bulkStringCopiesContent() {
        byte[] content = "value".getBytes();
        RespBulkString bs = RespBulkString.with(content);
        content[0] = 'X';
        bs.getContent()[1] = 'Y';

        assertEquals("value", bs.textualForm());
    }

    @Test
    void nullBulkStringToBytes() {
        RespBulkString bs = RespBulkString.nullBulkString();
        assertTrue(bs.isNull());
        assertEquals(-1, bs.getLength());
        assertArrayEquals("$-1\r\n".getBytes(), bs.toBytes());
        assertNotEquals(RespBulkString.withUTF8(""), bs);
    }

    @Test
    void arrayToBytes() {
        RespArray a = RespArray.with(RespBulkString.withUTF8("foo"), RespInteger.with(2),
                RespArray.with(RespSimpleString.withUTF8("x")), RespBulkString.nullBulkString());
        assertArrayEquals("*4\r\n$3\r\nfoo\r\n:2\r\n*1\r\n+x\r\n$-1\r\n".getBytes(), a.toBytes());
        assertArrayEquals("*0\r\n".getBytes(), RespArray.empty().toBytes());
    }

    @Test
    void arrayRejectsNone() {
        assertThrows(IllegalArgumentException.class, () -> RespArray.with(RespNone.none()));
    }

    @Test
    void noneEncodesToNothing() {
        assertEquals(0, RespNone.none().toBytes().length);
        assertFalse(RespNone.none().toByteBuffer().hasRemaining());
    }

    @Test
    void textualForm() {
        assertEquals("OK", RespSimpleString.withUTF8("OK").textualForm());
        assertEquals("bad", RespError.withUTF8("bad").textualForm());
        assertEquals("-7", RespInteger.with(-7).textualForm());
        assertEquals("bulk", RespBulkString.withUTF8("bulk").textualForm());
        assertEquals("", RespBulkString.nullBulkString().textualForm());
        assertEquals("", RespNone.none().textualForm());

        RespArray nested = RespArray.with(RespSimpleString.withUTF8("a"),
                RespArray.with(RespInteger.with(1), RespBulkString.withUTF8("b")), RespBulkString.nullBulkString());
        assertEquals("a 1 b ", nested.textualForm());
    }

    @Test
    void flattenLeaves() {
        RespArray a = RespArray.with(RespBulkString.withUTF8("set"), RespSimpleString.withUTF8("k"), RespInteger.with(3));
        assertEquals(Arrays.asList("set", "k", "3"), a.flatten());
    }

    @Test
    void flattenNestedInPlace() {
        RespArray a = RespArray.with(RespSimpleString.withUTF8("a"),
                RespArray.with(RespSimpleString.withUTF8("b"), RespArray.with(RespSimpleString.withUTF8("c"))),
                RespArray.empty(),
                RespSimpleString.withUTF8("d"));
        assertEquals(Arrays.asList("a", "b", "c", "d"), a.flatten());
    }

    @Test
    void flattenNonArray() {
        assertEquals(Collections.emptyList(), RespSimpleString.withUTF8("a").flatten());
        assertEquals(Collections.emptyList(), RespInteger.with(1).flatten());
        assertEquals(Collections.emptyList(), RespNone.none().flatten());
    }

    @Test
    void equality() {
        assertEquals(RespSimpleString.withUTF8("x"), RespSimpleString.withUTF8("x"));
        assertNotEquals(RespSimpleString.withUTF8("x"), RespError.withUTF8("x"));
        assertEquals(RespBulkString.withUTF8("x"), RespBulkString.with("x".getBytes()));
        assertEquals(RespArray.with(RespInteger.with(1)), RespArray.with(Collections.singletonList(RespInteger.with(1))));
    }
}
