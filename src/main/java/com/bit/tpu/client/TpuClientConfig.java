package com.bit.tpu.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import static com.bit.tpu.common.TpuConstants.DEFAULT_CLUSTER_REFRESH_INTERVAL_MS;
import static com.bit.tpu.common.TpuConstants.DEFAULT_FANOUT_SLOTS;
import static com.bit.tpu.common.TpuConstants.DEFAULT_REFRESH_INTERVAL_MS;
import static com.bit.tpu.common.TpuConstants.MAX_FANOUT_SLOTS;

/**
 * TPU 客户端运行参数
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TpuClientConfig {

    /**
     * 每笔交易广播覆盖的未来slot数，取值范围 [1, 100]，超出时取最近边界
     */
    @Builder.Default
    private int fanoutSlots = DEFAULT_FANOUT_SLOTS;

    @Builder.Default
    private long refreshIntervalMs = DEFAULT_REFRESH_INTERVAL_MS;

    @Builder.Default
    private long clusterRefreshIntervalMs = DEFAULT_CLUSTER_REFRESH_INTERVAL_MS;

    public static TpuClientConfig defaults() {
        return TpuClientConfig.builder().build();
    }

    public int clampedFanoutSlots() {
        return Math.max(Math.min(fanoutSlots, MAX_FANOUT_SLOTS), 1);
    }
}
