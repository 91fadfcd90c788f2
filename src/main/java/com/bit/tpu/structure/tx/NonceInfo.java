package com.bit.tpu.structure.tx;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 持久化nonce信息：存在时用nonce值代替最近区块哈希
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class NonceInfo {
    /**
     * nonce账户当前存储的值（base58）
     */
    private String nonce;
}
