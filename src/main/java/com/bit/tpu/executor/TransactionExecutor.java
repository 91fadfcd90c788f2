package com.bit.tpu.executor;

import com.bit.tpu.rpc.dto.Blockhash;
import com.bit.tpu.structure.key.Keypair;
import com.bit.tpu.structure.tx.VersionedTransaction;

/**
 * 交易执行器：发送已签名交易并等待确认
 */
public interface TransactionExecutor {

    ExecutionResult executeAndConfirm(VersionedTransaction transaction, Keypair payer, Blockhash latestBlockhash,
                                      boolean skipPreflight);
}
