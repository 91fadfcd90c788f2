package com.bit.tpu.client;

import com.bit.tpu.common.Commitment;
import com.bit.tpu.exception.ErrorType;
import com.bit.tpu.exception.TpuException;
import com.bit.tpu.rpc.ClusterQueryClient;
import com.bit.tpu.rpc.SlotUpdateSubscriber;
import com.bit.tpu.rpc.dto.SignatureStatus;
import com.bit.tpu.structure.key.Keypair;
import com.bit.tpu.structure.tx.AbstractTransaction;
import com.bit.tpu.structure.tx.VersionedTransaction;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * RPC 查询 + TPU 直发的组合入口
 * 交易走 UDP 直发给领导者，确认仍通过 RPC 查询
 */
@Slf4j
public class TpuConnection implements AutoCloseable {

    // 确认轮询间隔，约一个slot
    static final long CONFIRM_POLL_INTERVAL_MS = 400;
    // 没有区块高度上限时的最长等待时间
    static final long CONFIRM_TIMEOUT_MS = 60_000;

    @Getter
    private final ClusterQueryClient client;
    @Getter
    private final TpuClient tpuClient;
    private final long pollIntervalMs;

    TpuConnection(ClusterQueryClient client, TpuClient tpuClient, long pollIntervalMs) {
        this.client = client;
        this.tpuClient = tpuClient;
        this.pollIntervalMs = pollIntervalMs;
    }

    public static TpuConnection load(ClusterQueryClient client, SlotUpdateSubscriber subscriber, TpuClientConfig config) {
        return new TpuConnection(client, TpuClient.load(client, subscriber, config), CONFIRM_POLL_INTERVAL_MS);
    }

    public CompletableFuture<String> sendTransaction(AbstractTransaction transaction, List<Keypair> signers) {
        return tpuClient.sendTransaction(transaction, signers);
    }

    public CompletableFuture<String> sendTransaction(VersionedTransaction transaction) {
        return tpuClient.sendTransaction(transaction);
    }

    public CompletableFuture<String> sendRawTransaction(byte[] rawTransaction) {
        return tpuClient.sendRawTransaction(rawTransaction);
    }

    /**
     * 发送并等待确认，交易执行出错时抛出 TRANSACTION_FAILED
     */
    public String sendAndConfirmTransaction(AbstractTransaction transaction, List<Keypair> signers, Commitment commitment) {
        String signature = await(tpuClient.sendTransaction(transaction, signers));
        return requireSuccess(signature, confirmTransaction(signature, commitment, null));
    }

    public String sendAndConfirmRawTransaction(byte[] rawTransaction, Commitment commitment) {
        String signature = await(tpuClient.sendRawTransaction(rawTransaction));
        return requireSuccess(signature, confirmTransaction(signature, commitment, null));
    }

    /**
     * 等待发送结果，解开 CompletionException 直接抛出原始异常
     */
    static String await(CompletableFuture<String> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static String requireSuccess(String signature, SignatureStatus status) {
        if (status == null) {
            throw new TpuException(ErrorType.TRANSACTION_FAILED, "交易 " + signature + " 未在有效期内确认");
        }
        if (status.getErr() != null) {
            throw new TpuException(ErrorType.TRANSACTION_FAILED, "交易 " + signature + " 执行失败（" + status + "）");
        }
        return signature;
    }

    /**
     * 轮询签名状态直到达到指定确认级别
     * @param lastValidBlockHeight 区块哈希的最后有效高度，超过后判定未确认；为null时按超时时间判定
     * @return 达到确认级别（或执行出错）时的状态；过期或超时返回null
     */
    public SignatureStatus confirmTransaction(String signature, Commitment commitment, Long lastValidBlockHeight) {
        long deadline = System.currentTimeMillis() + CONFIRM_TIMEOUT_MS;
        while (true) {
            List<SignatureStatus> statuses = client.getSignatureStatuses(Collections.singletonList(signature));
            SignatureStatus status = statuses.isEmpty() ? null : statuses.get(0);
            if (status != null) {
                if (status.getErr() != null) {
                    return status;
                }
                String confirmationStatus = status.getConfirmationStatus();
                if (confirmationStatus != null && Commitment.fromValue(confirmationStatus).reaches(commitment)) {
                    log.debug("交易 {} 已达到 {}", signature, confirmationStatus);
                    return status;
                }
            }

            if (lastValidBlockHeight != null) {
                if (client.getBlockHeight(commitment) > lastValidBlockHeight) {
                    log.warn("交易 {} 的区块哈希已过期（最后有效高度：{}）", signature, lastValidBlockHeight);
                    return null;
                }
            } else if (System.currentTimeMillis() > deadline) {
                log.warn("交易 {} 确认超时", signature);
                return null;
            }

            try {
                TimeUnit.MILLISECONDS.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TpuException(ErrorType.TRANSACTION_FAILED, "等待交易 " + signature + " 确认时线程中断", e);
            }
        }
    }

    @Override
    public void close() {
        tpuClient.close();
    }
}
