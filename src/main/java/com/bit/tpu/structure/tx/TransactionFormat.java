package com.bit.tpu.structure.tx;

/**
 * 交易线格式：消息首字节最高位为1表示版本化消息，低7位为版本号
 */
public enum TransactionFormat {
    LEGACY,
    V0;

    public static final int VERSION_PREFIX_MASK = 0x80;

    public static TransactionFormat fromMessagePrefix(int firstByte) {
        if ((firstByte & VERSION_PREFIX_MASK) == 0) {
            return LEGACY;
        }
        int version = firstByte & 0x7F;
        if (version != 0) {
            throw new IllegalArgumentException("不支持的交易消息版本：" + version);
        }
        return V0;
    }
}
