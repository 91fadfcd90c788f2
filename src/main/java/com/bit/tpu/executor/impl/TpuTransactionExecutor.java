package com.bit.tpu.executor.impl;

import com.bit.tpu.client.TpuConnection;
import com.bit.tpu.common.Commitment;
import com.bit.tpu.exception.TpuException;
import com.bit.tpu.executor.ExecutionResult;
import com.bit.tpu.executor.TransactionExecutor;
import com.bit.tpu.rpc.dto.Blockhash;
import com.bit.tpu.rpc.dto.SignatureStatus;
import com.bit.tpu.structure.key.Keypair;
import com.bit.tpu.structure.tx.VersionedTransaction;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletionException;

/**
 * 通过 TPU 直发执行交易，确认走 RPC
 * TPU 直发没有预执行，skipPreflight 不起作用
 */
@Slf4j
public class TpuTransactionExecutor implements TransactionExecutor {

    private final TpuConnection tpuConnection;
    private final Commitment commitment;

    public TpuTransactionExecutor(TpuConnection tpuConnection, Commitment commitment) {
        this.tpuConnection = tpuConnection;
        this.commitment = commitment;
    }

    @Override
    public ExecutionResult executeAndConfirm(VersionedTransaction transaction, Keypair payer, Blockhash latestBlockhash,
                                             boolean skipPreflight) {
        log.debug("开始执行交易，付款账户：{}", payer.getPublicKey());
        String signature;
        try {
            signature = tpuConnection.sendRawTransaction(transaction.serialize()).join();
        } catch (CompletionException | TpuException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.warn("交易发送失败", cause);
            return ExecutionResult.unconfirmed(null, cause.getMessage());
        }

        log.debug("等待交易确认：{}", signature);
        try {
            SignatureStatus status = tpuConnection.confirmTransaction(signature, commitment,
                    latestBlockhash.getLastValidBlockHeight());
            if (status == null) {
                return ExecutionResult.unconfirmed(signature, "区块哈希已过期，交易未确认");
            }
            if (status.getErr() != null) {
                return ExecutionResult.unconfirmed(signature, String.valueOf(status.getErr()));
            }
            return ExecutionResult.confirmed(signature);
        } catch (TpuException e) {
            log.warn("交易确认失败：{}", signature, e);
            return ExecutionResult.unconfirmed(signature, e.getMessage());
        }
    }
}
