package com.bit.tpu.rpc.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * getLatestBlockhash 返回值
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Blockhash {
    private String blockhash;
    /**
     * 超过该区块高度后使用此哈希的交易不再有效
     */
    private long lastValidBlockHeight;
}
