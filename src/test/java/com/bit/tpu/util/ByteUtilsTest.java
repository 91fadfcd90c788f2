package com.bit.tpu.util;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class ByteUtilsTest {

    private static byte[] encode(int value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteUtils.writeCompactU16(out, value);
        return out.toByteArray();
    }

    @Test
    void testCompactU16Encoding() {
        assertArrayEquals(new byte[]{0x00}, encode(0));
        assertArrayEquals(new byte[]{0x7f}, encode(0x7f));
        assertArrayEquals(new byte[]{(byte) 0x80, 0x01}, encode(0x80));
        assertArrayEquals(new byte[]{(byte) 0xff, 0x7f}, encode(0x3fff));
        assertArrayEquals(new byte[]{(byte) 0x80, (byte) 0x80, 0x01}, encode(0x4000));
        assertArrayEquals(new byte[]{(byte) 0xff, (byte) 0xff, 0x03}, encode(0xffff));
    }

    @Test
    void testCompactU16Decoding() {
        int[] cursor = {1};
        byte[] bytes = {0x55, (byte) 0x80, 0x01, 0x05};
        assertEquals(0x80, ByteUtils.readCompactU16(bytes, cursor));
        assertEquals(3, cursor[0], "游标应移动到下一个字节");
        assertEquals(5, ByteUtils.readCompactU16(bytes, cursor));
    }

    @Test
    void testCompactU16Rejects() {
        assertThrows(IllegalArgumentException.class, () -> encode(0x10000));
        assertThrows(IllegalArgumentException.class, () -> encode(-1));
        // 被截断
        assertThrows(IllegalArgumentException.class, () -> ByteUtils.readCompactU16(new byte[]{(byte) 0x80}, new int[]{0}));
        // 超过3字节
        assertThrows(IllegalArgumentException.class,
                () -> ByteUtils.readCompactU16(new byte[]{(byte) 0x80, (byte) 0x80, (byte) 0x80, 0x01}, new int[]{0}));
        // 第三字节超出u16
        assertThrows(IllegalArgumentException.class,
                () -> ByteUtils.readCompactU16(new byte[]{(byte) 0xff, (byte) 0xff, 0x04}, new int[]{0}));
    }

    @Test
    void testBytesToHex() {
        assertEquals("00ff10", ByteUtils.bytesToHex(new byte[]{0, (byte) 0xff, 0x10}));
    }
}
