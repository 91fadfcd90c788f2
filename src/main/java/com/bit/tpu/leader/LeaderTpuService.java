package com.bit.tpu.leader;

import com.bit.tpu.client.TpuClientConfig;
import com.bit.tpu.common.Commitment;
import com.bit.tpu.common.Pubkey;
import com.bit.tpu.exception.TpuException;
import com.bit.tpu.rpc.ClusterQueryClient;
import com.bit.tpu.rpc.SlotUpdateSubscriber;
import com.bit.tpu.rpc.dto.EpochInfo;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

import static com.bit.tpu.common.TpuConstants.MAX_FANOUT_SLOTS;

/**
 * 领导者TPU刷新服务
 * 单线程定时任务是缓存的唯一写入方：按估算的当前slot滚动刷新领导者列表，
 * 定期刷新节点TPU地址，临近纪元边界时刷新纪元信息；
 * slot推送（若配置）直接写入最近slot窗口，与定时任务节奏无关；未配置时每轮刷新主动查询当前slot
 */
@Slf4j
public class LeaderTpuService implements AutoCloseable {

    private final ClusterQueryClient client;
    private final RecentLeaderSlots recentSlots;
    private final LeaderTpuCache leaderTpuCache;
    private final TpuClientConfig config;
    private final LongSupplier clock;

    // 定时任务调度器（单线程确保刷新顺序）
    private final ScheduledExecutorService refreshScheduler;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile SlotUpdateSubscriber.Subscription subscription;
    private volatile long lastClusterRefresh;

    LeaderTpuService(ClusterQueryClient client, RecentLeaderSlots recentSlots, LeaderTpuCache leaderTpuCache,
                     TpuClientConfig config, LongSupplier clock) {
        this.client = client;
        this.recentSlots = recentSlots;
        this.leaderTpuCache = leaderTpuCache;
        this.config = config;
        this.clock = clock;
        this.lastClusterRefresh = clock.getAsLong();
        this.refreshScheduler = Executors.newSingleThreadScheduledExecutor(new DefaultThreadFactory("leader-tpu-refresh", true));
    }

    public static LeaderTpuService load(ClusterQueryClient client, SlotUpdateSubscriber subscriber) {
        return load(client, subscriber, TpuClientConfig.defaults());
    }

    /**
     * 以 processed 级别的当前slot为起点加载缓存，订阅slot推送（subscriber可为null），并启动刷新任务
     */
    public static LeaderTpuService load(ClusterQueryClient client, SlotUpdateSubscriber subscriber, TpuClientConfig config) {
        long startSlot = client.getSlot(Commitment.PROCESSED);
        RecentLeaderSlots recentSlots = new RecentLeaderSlots(startSlot);
        LeaderTpuCache leaderTpuCache = LeaderTpuCache.load(client, startSlot);

        LeaderTpuService service = new LeaderTpuService(client, recentSlots, leaderTpuCache, config, System::currentTimeMillis);
        if (subscriber != null) {
            service.subscription = subscriber.subscribe(update -> recentSlots.recordSlot(update.observedSlot()));
            log.info("已订阅slot推送");
        }
        service.start();
        return service;
    }

    void start() {
        refreshScheduler.scheduleWithFixedDelay(this::runRefresh,
                config.getRefreshIntervalMs(), config.getRefreshIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("领导者TPU刷新任务已启动，刷新间隔：{}ms", config.getRefreshIntervalMs());
    }

    private void runRefresh() {
        try {
            refresh();
        } catch (TpuException e) {
            // 估算失败只影响本轮，下一轮继续
            log.error("领导者TPU刷新失败", e);
        } catch (RuntimeException e) {
            log.error("领导者TPU刷新出现未预期异常", e);
        }
    }

    /**
     * 单轮刷新，各步骤独立失败：失败只打印告警并保留原有状态
     */
    void refresh() {
        if (clock.getAsLong() - lastClusterRefresh > config.getClusterRefreshIntervalMs()) {
            try {
                Map<Pubkey, InetSocketAddress> leaderTpuMap = leaderTpuCache.fetchClusterTpuSockets();
                leaderTpuCache.updateLeaderTpuMap(leaderTpuMap);
                lastClusterRefresh = clock.getAsLong();
                log.debug("节点TPU地址已刷新，节点数量：{}", leaderTpuMap.size());
            } catch (RuntimeException e) {
                log.warn("刷新节点TPU地址失败", e);
            }
        }

        // 未订阅slot推送时，每轮主动查询一次 processed slot
        if (subscription == null) {
            try {
                recentSlots.recordSlot(client.getSlot(Commitment.PROCESSED));
            } catch (RuntimeException e) {
                log.warn("查询当前slot失败", e);
            }
        }

        long estimatedCurrentSlot = recentSlots.estimatedCurrentSlot();

        if (estimatedCurrentSlot >= leaderTpuCache.getLastEpochInfoSlot() - leaderTpuCache.getSlotsInEpoch()) {
            try {
                EpochInfo epochInfo = client.getEpochInfo(Commitment.PROCESSED);
                leaderTpuCache.updateEpochInfo(epochInfo.getSlotsInEpoch(), estimatedCurrentSlot);
            } catch (RuntimeException e) {
                log.warn("获取纪元信息失败（当前估算slot：{}）", estimatedCurrentSlot, e);
            }
        }

        if (estimatedCurrentSlot >= leaderTpuCache.lastSlot() - MAX_FANOUT_SLOTS) {
            try {
                List<Pubkey> slotLeaders = leaderTpuCache.fetchSlotLeaders(estimatedCurrentSlot, leaderTpuCache.getSlotsInEpoch());
                leaderTpuCache.updateSlotLeaders(estimatedCurrentSlot, slotLeaders);
                log.debug("领导者列表已刷新，slot区间：[{}, {}]", estimatedCurrentSlot, leaderTpuCache.lastSlot());
            } catch (RuntimeException e) {
                log.warn("获取领导者列表失败（当前估算slot：{}）", estimatedCurrentSlot, e);
            }
        }
    }

    public List<InetSocketAddress> leaderTpuSockets(int fanoutSlots) {
        log.debug("获取领导者TPU地址，fanoutSlots：{}", fanoutSlots);
        return leaderTpuCache.getLeaderSockets(fanoutSlots);
    }

    public long estimatedCurrentSlot() {
        return recentSlots.estimatedCurrentSlot();
    }

    public RecentLeaderSlots getRecentSlots() {
        return recentSlots;
    }

    public LeaderTpuCache getLeaderTpuCache() {
        return leaderTpuCache;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * 停止刷新任务并退订slot推送，可重复调用
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        SlotUpdateSubscriber.Subscription current = subscription;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                log.warn("退订slot推送失败", e);
            }
            subscription = null;
        }
        refreshScheduler.shutdownNow();
        log.info("领导者TPU刷新任务已停止");
    }
}
