package com.bit.tpu.common;

public class TpuConstants {

    // 估算当前slot时允许的最大跳跃距离
    public static final long MAX_SLOT_SKIP_DISTANCE = 48;

    public static final int DEFAULT_FANOUT_SLOTS = 12;
    public static final int MAX_FANOUT_SLOTS = 100;

    // 最近slot窗口容量
    public static final int MAX_RECENT_SLOTS = 12;

    // 后台刷新间隔（ms）
    public static final long DEFAULT_REFRESH_INTERVAL_MS = 1000;
    // 节点TPU地址全量刷新间隔（ms）：5分钟
    public static final long DEFAULT_CLUSTER_REFRESH_INTERVAL_MS = 5 * 60 * 1000;

    private TpuConstants() {}
}
