package com.bit.tpu.config;

import com.bit.tpu.client.TpuConnection;
import com.bit.tpu.common.Commitment;
import com.bit.tpu.exception.ErrorType;
import com.bit.tpu.exception.TpuException;
import com.bit.tpu.executor.TransactionExecutor;
import com.bit.tpu.executor.impl.TpuTransactionExecutor;
import com.bit.tpu.rpc.ClusterQueryClient;
import com.bit.tpu.rpc.SlotUpdateSubscriber;
import com.bit.tpu.rpc.impl.JsonRpcClusterClient;
import com.bit.tpu.rpc.impl.WebSocketSlotSubscriber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * TPU 客户端组件装配：RPC 客户端 -> slot推送 -> TpuConnection -> 交易执行器
 */
@Slf4j
@Configuration
public class CommonConfig {

    @Bean
    public ClusterQueryClient clusterQueryClient(TpuClientProperties properties) {
        if (!StringUtils.hasText(properties.getRpcUrl())) {
            throw new TpuException(ErrorType.CONFIG_INVALID, "未配置 tpu.rpc-url");
        }
        log.info("RPC地址：{}", properties.getRpcUrl());
        return new JsonRpcClusterClient(properties.getRpcUrl(), properties.getRpcTimeoutMs());
    }

    @Bean(destroyMethod = "close")
    public TpuConnection tpuConnection(ClusterQueryClient clusterQueryClient, TpuClientProperties properties) {
        SlotUpdateSubscriber subscriber = null;
        if (StringUtils.hasText(properties.getWebsocketUrl())) {
            subscriber = new WebSocketSlotSubscriber(properties.getWebsocketUrl());
        } else {
            log.info("未配置 tpu.websocket-url，不订阅slot推送");
        }
        return TpuConnection.load(clusterQueryClient, subscriber, properties.toClientConfig());
    }

    @Bean
    public TransactionExecutor transactionExecutor(TpuConnection tpuConnection, TpuClientProperties properties) {
        return new TpuTransactionExecutor(tpuConnection, Commitment.fromValue(properties.getCommitment()));
    }
}
