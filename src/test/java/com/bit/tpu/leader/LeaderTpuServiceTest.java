package com.bit.tpu.leader;

import com.bit.tpu.client.TpuClientConfig;
import com.bit.tpu.common.Pubkey;
import com.bit.tpu.rpc.FakeClusterQueryClient;
import com.bit.tpu.rpc.SlotUpdateSubscriber;
import com.bit.tpu.rpc.dto.ContactInfo;
import com.bit.tpu.rpc.dto.SlotUpdate;
import com.bit.tpu.rpc.dto.SlotUpdateType;
import com.bit.tpu.structure.key.Keypair;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
public class LeaderTpuServiceTest {

    private Pubkey leaderA;
    private FakeClusterQueryClient client;
    private final AtomicLong clock = new AtomicLong();
    private RecentLeaderSlots recentSlots;
    private LeaderTpuCache cache;
    private LeaderTpuService service;

    @BeforeEach
    void setUp() {
        leaderA = Keypair.generate().getPublicKey();
        client = new FakeClusterQueryClient(leaderA);
        client.nodes.add(ContactInfo.of(leaderA.toBase58(), "127.0.0.1:8001"));
        recentSlots = new RecentLeaderSlots(1000);
        cache = LeaderTpuCache.load(client, 1000);
        service = new LeaderTpuService(client, recentSlots, cache, TpuClientConfig.defaults(), clock::get);
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    private void observe(long slot, int times) {
        for (int i = 0; i < times; i++) {
            recentSlots.recordSlot(slot);
        }
    }

    @Test
    void testLeadersNotRefreshedWhileFarFromEnd() {
        observe(1050, 3);
        service.refresh();

        assertEquals(1, client.slotLeadersCalls.get(), "距离缓存末尾较远时不应刷新领导者");
        assertEquals(1000, cache.getFirstSlot());
    }

    @Test
    void testLeadersRefreshedNearEnd() {
        // lastSlot=1199，估算值达到 1199-100 时刷新
        observe(1100, 3);
        assertEquals(1100, service.estimatedCurrentSlot());
        service.refresh();

        assertEquals(2, client.slotLeadersCalls.get());
        assertEquals(1100, client.lastSlotLeadersStart);
        assertEquals(1100, cache.getFirstSlot());
        assertEquals(1299, cache.lastSlot());
    }

    @Test
    void testEpochInfoRefreshed() {
        observe(1050, 3);
        client.slotsInEpoch = 8192;
        service.refresh();

        assertEquals(8192, cache.getSlotsInEpoch());
        assertEquals(1050, cache.getLastEpochInfoSlot());
    }

    @Test
    void testClusterNodesRefreshedAfterInterval() {
        Pubkey leaderB = Keypair.generate().getPublicKey();
        client.nodes.add(ContactInfo.of(leaderB.toBase58(), "127.0.0.1:8002"));

        clock.set(1000);
        service.refresh();
        assertEquals(1, client.clusterNodesCalls.get(), "未到刷新间隔不应获取节点");
        assertFalse(cache.getLeaderTpuMap().containsKey(leaderB));

        clock.set(300_001);
        service.refresh();
        assertEquals(2, client.clusterNodesCalls.get());
        assertEquals(new InetSocketAddress("127.0.0.1", 8002), cache.getLeaderTpuMap().get(leaderB));

        // 刷新成功后重新计时
        clock.set(300_500);
        service.refresh();
        assertEquals(2, client.clusterNodesCalls.get());
    }

    @Test
    void testFailedRefreshKeepsState() {
        observe(1150, 3);
        clock.set(1_000_000);
        client.failClusterNodes = true;
        client.failEpochInfo = true;
        client.failSlotLeaders = true;
        client.slotsInEpoch = 64;
        LeaderTpuSnapshot before = cache.snapshot();

        service.refresh();

        assertSame(before, cache.snapshot(), "刷新失败后缓存应保持不变");
        assertEquals(432_000, cache.getSlotsInEpoch());
        assertEquals(1000, cache.getLastEpochInfoSlot());
        assertEquals(2, client.epochInfoCalls.get());
        assertEquals(2, client.clusterNodesCalls.get());
        assertEquals(2, client.slotLeadersCalls.get());
    }

    @Test
    void testClusterFailureDoesNotBlockLeaderRefresh() {
        observe(1150, 3);
        clock.set(1_000_000);
        client.failClusterNodes = true;
        Pubkey leaderB = Keypair.generate().getPublicKey();
        client.defaultLeader = leaderB;

        service.refresh();

        assertEquals(1150, cache.getFirstSlot());
        assertEquals(leaderB, cache.getSlotLeader(1150));
        assertTrue(cache.getLeaderTpuMap().containsKey(leaderA), "节点映射应保持原样");
    }

    @Test
    void testPollsSlotWithoutSubscription() {
        client.slot = 1150;

        service.refresh();
        assertEquals(1, client.slotCalls.get(), "未订阅推送时每轮刷新应查询当前slot");
        assertEquals(1000, cache.getFirstSlot(), "单个读数不足以推动中位数");

        service.refresh();
        assertEquals(2, client.slotCalls.get());
        assertEquals(List.of(1000L, 1150L, 1150L), recentSlots.snapshot());
        assertEquals(1150, cache.getFirstSlot(), "查询到的slot应推动领导者刷新");
    }

    @Test
    void testSlotPollFailureDoesNotBlockRefresh() {
        observe(1150, 3);
        client.failSlot = true;

        service.refresh();

        assertEquals(1, client.slotCalls.get());
        assertEquals(List.of(1000L, 1150L, 1150L, 1150L), recentSlots.snapshot());
        assertEquals(1150, cache.getFirstSlot());
    }

    @Test
    void testNoSlotPollingWithSubscription() {
        SlotUpdateSubscriber subscriber = consumer -> () -> { };
        LeaderTpuService loaded = LeaderTpuService.load(client, subscriber);
        try {
            int callsAfterLoad = client.slotCalls.get();
            loaded.refresh();
            assertEquals(callsAfterLoad, client.slotCalls.get(), "已订阅推送时不应轮询slot");
        } finally {
            loaded.close();
        }
    }

    @Test
    void testLeaderTpuSockets() {
        List<InetSocketAddress> sockets = service.leaderTpuSockets(12);
        assertEquals(List.of(new InetSocketAddress("127.0.0.1", 8001)), sockets);
    }

    @Test
    void testSubscriptionFeedsRecentSlots() {
        AtomicReference<Consumer<SlotUpdate>> handler = new AtomicReference<>();
        AtomicBoolean unsubscribed = new AtomicBoolean(false);
        SlotUpdateSubscriber subscriber = consumer -> {
            handler.set(consumer);
            return () -> unsubscribed.set(true);
        };

        LeaderTpuService loaded = LeaderTpuService.load(client, subscriber);
        try {
            assertNotNull(handler.get());
            handler.get().accept(new SlotUpdate(1010, SlotUpdateType.COMPLETED, 0));
            handler.get().accept(new SlotUpdate(1020, SlotUpdateType.FIRST_SHRED_RECEIVED, 0));

            List<Long> window = loaded.getRecentSlots().snapshot();
            assertEquals(List.of(1000L, 1011L, 1020L), window, "completed 应记录为下一个slot");
        } finally {
            loaded.close();
        }
        assertTrue(unsubscribed.get(), "关闭服务时应退订");
        assertTrue(loaded.isClosed());
        loaded.close();
    }

    @Test
    void testScheduledRefreshRuns() throws InterruptedException {
        TpuClientConfig config = TpuClientConfig.builder().refreshIntervalMs(20).build();
        LeaderTpuService loaded = LeaderTpuService.load(client, null, config);
        // 定时刷新会查询当前slot
        client.slot = 1150;
        try {
            for (int i = 0; i < 3; i++) {
                loaded.getRecentSlots().recordSlot(1150);
            }
            long deadline = System.currentTimeMillis() + 5000;
            while (loaded.getLeaderTpuCache().getFirstSlot() != 1150 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertEquals(1150, loaded.getLeaderTpuCache().getFirstSlot(), "定时任务应刷新领导者列表");
        } finally {
            loaded.close();
        }
    }
}
