package com.bit.tpu.service;

import com.bit.tpu.api.dto.SendRawRequest;
import com.bit.tpu.result.Result;

public interface TxService {

    /**
     * 通过TPU直发一笔已签名交易，成功返回交易签名
     */
    Result<String> sendRawTx(SendRawRequest request);
}
