package com.bit.tpu.leader;

import com.bit.tpu.common.Pubkey;
import lombok.Getter;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 领导者缓存的不可变快照，刷新时整体替换
 * 读方一次调用内只使用同一个快照，可能过期但内部一致
 */
@Getter
public final class LeaderTpuSnapshot {

    private final long firstSlot;

    /**
     * 下标 = slot - firstSlot
     */
    private final List<Pubkey> leaders;

    /**
     * 值为null表示该节点没有公开TPU地址
     */
    private final Map<Pubkey, InetSocketAddress> leaderTpuMap;

    LeaderTpuSnapshot(long firstSlot, List<Pubkey> leaders, Map<Pubkey, InetSocketAddress> leaderTpuMap) {
        this.firstSlot = firstSlot;
        this.leaders = Collections.unmodifiableList(new ArrayList<>(leaders));
        this.leaderTpuMap = Collections.unmodifiableMap(new HashMap<>(leaderTpuMap));
    }

    LeaderTpuSnapshot withLeaders(long newFirstSlot, List<Pubkey> newLeaders) {
        return new LeaderTpuSnapshot(newFirstSlot, newLeaders, leaderTpuMap);
    }

    LeaderTpuSnapshot withLeaderTpuMap(Map<Pubkey, InetSocketAddress> newLeaderTpuMap) {
        return new LeaderTpuSnapshot(firstSlot, leaders, newLeaderTpuMap);
    }

    public long lastSlot() {
        return firstSlot + leaders.size() - 1;
    }
}
