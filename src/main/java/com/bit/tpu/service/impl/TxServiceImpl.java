package com.bit.tpu.service.impl;

import com.bit.tpu.api.dto.SendRawRequest;
import com.bit.tpu.client.TpuConnection;
import com.bit.tpu.exception.ErrorType;
import com.bit.tpu.exception.TpuException;
import com.bit.tpu.result.Result;
import com.bit.tpu.service.TxService;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.Base58;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.concurrent.CompletionException;

@Slf4j
@Component
public class TxServiceImpl implements TxService {

    @Autowired
    private TpuConnection tpuConnection;

    public TxServiceImpl() {
    }

    TxServiceImpl(TpuConnection tpuConnection) {
        this.tpuConnection = tpuConnection;
    }

    @Override
    public Result<String> sendRawTx(SendRawRequest request) {
        // 1. 前置校验
        if (request == null || request.getTransaction() == null || request.getTransaction().isEmpty()) {
            return Result.error(Result.SC_BAD_REQUEST_400, "无效交易：内容为空");
        }

        // 2. 解码
        byte[] rawTransaction;
        try {
            rawTransaction = decode(request.getTransaction(), request.getEncoding());
        } catch (IllegalArgumentException e) {
            return Result.error(Result.SC_BAD_REQUEST_400, "无效交易：" + e.getMessage());
        }

        // 3. 发送
        try {
            String signature = tpuConnection.sendRawTransaction(rawTransaction).join();
            return Result.OK("交易已发送", signature);
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("交易发送失败", cause);
            return Result.error(statusOf(cause), cause.getMessage());
        }
    }

    private static byte[] decode(String transaction, String encoding) {
        if (encoding == null || "base58".equalsIgnoreCase(encoding)) {
            return Base58.decode(transaction);
        }
        if ("base64".equalsIgnoreCase(encoding)) {
            return Base64.getDecoder().decode(transaction);
        }
        throw new IllegalArgumentException("不支持的编码：" + encoding);
    }

    private static int statusOf(Throwable cause) {
        if (cause instanceof TpuException tpuException) {
            ErrorType errorType = tpuException.getErrorType();
            if (errorType == ErrorType.INVALID_TRANSACTION || errorType == ErrorType.INVALID_ARGUMENTS) {
                return Result.SC_BAD_REQUEST_400;
            }
        }
        return Result.SC_INTERNAL_SERVER_ERROR_500;
    }
}
