package com.bit.tpu.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 原始交易提交请求
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class SendRawRequest {
    /**
     * 已签名的序列化交易
     */
    private String transaction;
    /**
     * base58（默认）或 base64
     */
    private String encoding = "base58";
}
