package com.bit.tpu.config;

import com.bit.tpu.client.TpuClientConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import static com.bit.tpu.common.TpuConstants.DEFAULT_CLUSTER_REFRESH_INTERVAL_MS;
import static com.bit.tpu.common.TpuConstants.DEFAULT_FANOUT_SLOTS;
import static com.bit.tpu.common.TpuConstants.DEFAULT_REFRESH_INTERVAL_MS;

@Data
@Component
@ConfigurationProperties(prefix = "tpu")
public class TpuClientProperties {
    private String rpcUrl;//HTTP JSON-RPC 地址
    private String websocketUrl;//slot推送地址，为空时每轮刷新通过 getSlot 查询当前slot
    private int fanoutSlots = DEFAULT_FANOUT_SLOTS;
    private String commitment = "confirmed";//确认交易时的级别
    private long refreshIntervalMs = DEFAULT_REFRESH_INTERVAL_MS;
    private long clusterRefreshIntervalMs = DEFAULT_CLUSTER_REFRESH_INTERVAL_MS;
    private int rpcTimeoutMs = 10_000;

    public TpuClientConfig toClientConfig() {
        return TpuClientConfig.builder()
                .fanoutSlots(fanoutSlots)
                .refreshIntervalMs(refreshIntervalMs)
                .clusterRefreshIntervalMs(clusterRefreshIntervalMs)
                .build();
    }
}
