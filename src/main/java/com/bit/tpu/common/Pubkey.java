package com.bit.tpu.common;

import lombok.EqualsAndHashCode;
import org.bitcoinj.core.Base58;

import java.util.Arrays;

/**
 * 公钥封装（32字节），统一账户/程序/验证者身份的地址表示
 * 按值比较，可直接作为Map的key
 */
@EqualsAndHashCode
public class Pubkey {
    public static final int LENGTH = 32;
    private final byte[] value;

    private Pubkey(byte[] value) {
        if (value.length != LENGTH) {
            throw new IllegalArgumentException("公钥必须为32字节，实际为" + value.length + "字节");
        }
        this.value = value;
    }

    public static Pubkey fromBytes(byte[] bytes) {
        return new Pubkey(Arrays.copyOf(bytes, bytes.length));
    }

    public static Pubkey fromBase58(String base58) {
        return new Pubkey(Base58.decode(base58));
    }

    public byte[] toBytes() {
        return Arrays.copyOf(value, LENGTH);
    }

    public String toBase58() {
        return Base58.encode(value);
    }

    @Override
    public String toString() {
        return toBase58();
    }
}
