package com.bit.tpu.util;

import java.io.ByteArrayOutputStream;

public class ByteUtils {

    private ByteUtils() {}

    /**
     * 字节数组转十六进制字符串
     */
    public static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder();
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }

    /**
     * 写入 compact-u16（short vec）长度前缀：每字节低7位为数据，最高位为续位标志，最多3字节
     */
    public static void writeCompactU16(ByteArrayOutputStream out, int value) {
        if (value < 0 || value > 0xFFFF) {
            throw new IllegalArgumentException("compact-u16 超出范围：" + value);
        }
        int rem = value;
        while (true) {
            int elem = rem & 0x7F;
            rem >>>= 7;
            if (rem == 0) {
                out.write(elem);
                return;
            }
            out.write(elem | 0x80);
        }
    }

    /**
     * 读取 compact-u16
     * @param bytes 源数据
     * @param cursor 单元素数组，读前为起始偏移，读后为下一个字节的偏移
     */
    public static int readCompactU16(byte[] bytes, int[] cursor) {
        int value = 0;
        int size = 0;
        while (true) {
            if (cursor[0] >= bytes.length) {
                throw new IllegalArgumentException("compact-u16 数据被截断，偏移：" + cursor[0]);
            }
            if (size >= 3) {
                throw new IllegalArgumentException("compact-u16 长度超过3字节");
            }
            int elem = bytes[cursor[0]++] & 0xFF;
            value |= (elem & 0x7F) << (size * 7);
            size++;
            if ((elem & 0x80) == 0) {
                break;
            }
        }
        if (value > 0xFFFF) {
            throw new IllegalArgumentException("compact-u16 超出范围：" + value);
        }
        return value;
    }
}
