package com.bit.tpu.structure.tx;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bitcoinj.core.Base58;

/**
 * 交易签名（基于Ed25519算法）
 * 每个签名对应一个"需要签名的账户"，第一个签名即交易ID
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Signature {
    public static final int LENGTH = 64;

    /**
     * 签名字节数组（64字节）
     * 本质是对交易消息序列化结果的签名，可通过账户公钥验证
     */
    private byte[] value;

    public static Signature fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("签名必须为64字节");
        }
        return new Signature(bytes.clone());
    }

    public String toBase58() {
        return Base58.encode(value);
    }
}
