package com.bit.tpu.rpc.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * getSignatureStatuses 中单笔交易的状态
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SignatureStatus {
    private long slot;
    /**
     * 已root时为null
     */
    private Long confirmations;
    /**
     * 交易执行错误，成功时为null
     */
    private Object err;
    private String confirmationStatus;
}
