package com.bit.tpu.leader;

import com.bit.tpu.exception.ErrorType;
import com.bit.tpu.exception.TpuException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import static com.bit.tpu.common.TpuConstants.MAX_RECENT_SLOTS;
import static com.bit.tpu.common.TpuConstants.MAX_SLOT_SKIP_DISTANCE;

/**
 * 最近观测到的slot窗口（最多12个，按到达顺序，先进先出）
 * 推送线程写入，刷新线程估算，方法均加锁
 */
public class RecentLeaderSlots {

    private final Deque<Long> recentSlots = new ArrayDeque<>(MAX_RECENT_SLOTS + 1);

    public RecentLeaderSlots() {
    }

    public RecentLeaderSlots(long currentSlot) {
        recentSlots.addLast(currentSlot);
    }

    /**
     * 记录一个slot，超出容量时淘汰最早的记录；不要求单调递增
     */
    public synchronized void recordSlot(long currentSlot) {
        recentSlots.addLast(currentSlot);
        while (recentSlots.size() > MAX_RECENT_SLOTS) {
            recentSlots.pollFirst();
        }
    }

    /**
     * 估算当前slot
     * 取中位数并按其后方的样本数向前推进，得到期望值；
     * 超过 期望值+48 的读数视为异常，返回不超过该上限的最大读数
     */
    public synchronized long estimatedCurrentSlot() {
        if (recentSlots.isEmpty()) {
            throw new TpuException(ErrorType.EMPTY_STATE, "无法估算当前slot");
        }
        long[] sorted = new long[recentSlots.size()];
        int i = 0;
        for (long slot : recentSlots) {
            sorted[i++] = slot;
        }
        Arrays.sort(sorted);

        int maxIndex = sorted.length - 1;
        int medianIndex = maxIndex / 2;
        long expectedCurrentSlot = sorted[medianIndex] + (maxIndex - medianIndex);
        long maxReasonableCurrentSlot = expectedCurrentSlot + MAX_SLOT_SKIP_DISTANCE;

        for (int j = maxIndex; j >= 0; j--) {
            if (sorted[j] <= maxReasonableCurrentSlot) {
                return sorted[j];
            }
        }
        // 中位数本身不会超过上限，不可达
        return sorted[medianIndex];
    }

    public synchronized int size() {
        return recentSlots.size();
    }

    /**
     * 按到达顺序返回当前窗口的拷贝
     */
    public synchronized List<Long> snapshot() {
        return new ArrayList<>(recentSlots);
    }
}
