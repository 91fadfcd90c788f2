package com.bit.tpu.structure.tx;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 消息头（3字节）
 * accountKeys 按 [可写签名者, 只读签名者, 可写非签名者, 只读非签名者] 排列
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class MessageHeader {
    /**
     * 需要签名的账户数量，即 accountKeys 的前N个
     */
    private int numRequiredSignatures;
    private int numReadonlySignedAccounts;
    private int numReadonlyUnsignedAccounts;
}
