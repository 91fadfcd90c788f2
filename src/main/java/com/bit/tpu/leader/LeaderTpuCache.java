package com.bit.tpu.leader;

import com.bit.tpu.common.Commitment;
import com.bit.tpu.common.Pubkey;
import com.bit.tpu.exception.ErrorType;
import com.bit.tpu.exception.TpuException;
import com.bit.tpu.rpc.ClusterQueryClient;
import com.bit.tpu.rpc.dto.ContactInfo;
import com.bit.tpu.rpc.dto.EpochInfo;
import com.google.common.net.HostAndPort;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static com.bit.tpu.common.TpuConstants.MAX_FANOUT_SLOTS;

/**
 * 领导者TPU缓存
 * 保存 [firstSlot, lastSlot] 区间内每个slot的领导者，以及 领导者 -> TPU地址 的映射
 * 只有 LeaderTpuService 写入，其余组件只读
 */
@Slf4j
public class LeaderTpuCache {

    private final ClusterQueryClient client;

    private final AtomicReference<LeaderTpuSnapshot> snapshot = new AtomicReference<>();

    // 上次获取纪元信息时的每纪元slot数
    private volatile long slotsInEpoch;
    // 上次获取纪元信息时估算的slot
    private volatile long lastEpochInfoSlot;

    private LeaderTpuCache(ClusterQueryClient client) {
        this.client = client;
    }

    /**
     * 加载缓存：获取纪元信息 -> 领导者列表 -> 节点TPU地址
     * 失败直接抛出，由调用方决定是否重试
     */
    public static LeaderTpuCache load(ClusterQueryClient client, long startSlot) {
        LeaderTpuCache cache = new LeaderTpuCache(client);
        EpochInfo epochInfo = client.getEpochInfo(Commitment.CONFIRMED);
        cache.slotsInEpoch = epochInfo.getSlotsInEpoch();
        cache.lastEpochInfoSlot = startSlot;

        List<Pubkey> leaders = cache.fetchSlotLeaders(startSlot, cache.slotsInEpoch);
        Map<Pubkey, InetSocketAddress> leaderTpuMap = cache.fetchClusterTpuSockets();
        cache.snapshot.set(new LeaderTpuSnapshot(startSlot, leaders, leaderTpuMap));
        log.info("领导者缓存加载完成，起始slot：{}，领导者数量：{}，节点数量：{}，每纪元slot数：{}",
                startSlot, leaders.size(), leaderTpuMap.size(), cache.slotsInEpoch);
        return cache;
    }

    /**
     * 全量获取节点TPU地址，没有TPU（或地址无法解析）的节点映射为null
     */
    public Map<Pubkey, InetSocketAddress> fetchClusterTpuSockets() {
        List<ContactInfo> nodes = client.getClusterNodes();
        Map<Pubkey, InetSocketAddress> map = new HashMap<>(nodes.size() * 2);
        for (ContactInfo node : nodes) {
            map.put(Pubkey.fromBase58(node.getPubkey()), parseSocketAddress(node.getTpu()));
        }
        return map;
    }

    /**
     * 获取从 startSlot 开始的领导者，数量为 min(2*MAX_FANOUT_SLOTS, slotsInEpoch)
     */
    public List<Pubkey> fetchSlotLeaders(long startSlot, long slotsInEpoch) {
        long fanout = Math.min(2L * MAX_FANOUT_SLOTS, slotsInEpoch);
        List<Pubkey> leaders = client.getSlotLeaders(startSlot, fanout);
        if (leaders == null || leaders.isEmpty()) {
            throw new TpuException(ErrorType.RPC_FAILED, "slot " + startSlot + " 起的领导者列表为空");
        }
        return leaders;
    }

    public long lastSlot() {
        return snapshot.get().lastSlot();
    }

    public long getFirstSlot() {
        return snapshot.get().getFirstSlot();
    }

    public List<Pubkey> getLeaders() {
        return snapshot.get().getLeaders();
    }

    public Map<Pubkey, InetSocketAddress> getLeaderTpuMap() {
        return snapshot.get().getLeaderTpuMap();
    }

    public LeaderTpuSnapshot snapshot() {
        return snapshot.get();
    }

    public long getSlotsInEpoch() {
        return slotsInEpoch;
    }

    public long getLastEpochInfoSlot() {
        return lastEpochInfoSlot;
    }

    /**
     * 指定slot的领导者；slot早于缓存起点时返回null
     * slot 超过 lastSlot() 属于调用方错误，会抛出 IndexOutOfBoundsException
     */
    public Pubkey getSlotLeader(long slot) {
        LeaderTpuSnapshot current = snapshot.get();
        if (slot < current.getFirstSlot()) {
            return null;
        }
        return current.getLeaders().get(Math.toIntExact(slot - current.getFirstSlot()));
    }

    /**
     * 未来 fanoutSlots 个slot的领导者TPU地址
     * 按领导者去重并保持首次出现的顺序，没有TPU地址的领导者跳过
     */
    public List<InetSocketAddress> getLeaderSockets(int fanoutSlots) {
        LeaderTpuSnapshot current = snapshot.get();
        List<Pubkey> leaders = current.getLeaders();
        Map<Pubkey, InetSocketAddress> leaderTpuMap = current.getLeaderTpuMap();

        Set<Pubkey> leaderSet = new HashSet<>();
        Set<InetSocketAddress> socketSet = new HashSet<>();
        List<InetSocketAddress> leaderSockets = new ArrayList<>();
        int checkedSlots = Math.min(fanoutSlots, leaders.size());
        for (int i = 0; i < checkedSlots; i++) {
            Pubkey leader = leaders.get(i);
            InetSocketAddress tpuSocket = leaderTpuMap.get(leader);
            if (tpuSocket == null) {
                log.info("领导者没有可用的TPU地址：{}", leader);
                continue;
            }
            // 不同身份共用同一地址时也只发送一次
            if (leaderSet.add(leader) && socketSet.add(tpuSocket)) {
                leaderSockets.add(tpuSocket);
            }
        }
        return leaderSockets;
    }

    void updateSlotLeaders(long firstSlot, List<Pubkey> leaders) {
        snapshot.updateAndGet(current -> current.withLeaders(firstSlot, leaders));
    }

    void updateLeaderTpuMap(Map<Pubkey, InetSocketAddress> leaderTpuMap) {
        snapshot.updateAndGet(current -> current.withLeaderTpuMap(leaderTpuMap));
    }

    void updateEpochInfo(long slotsInEpoch, long referenceSlot) {
        this.slotsInEpoch = slotsInEpoch;
        this.lastEpochInfoSlot = referenceSlot;
    }

    /**
     * host:port -> InetSocketAddress，无法解析或端口为0时返回null
     */
    static InetSocketAddress parseSocketAddress(String tpu) {
        if (tpu == null || tpu.isEmpty()) {
            return null;
        }
        try {
            HostAndPort hostAndPort = HostAndPort.fromString(tpu);
            if (!hostAndPort.hasPort() || hostAndPort.getPort() == 0) {
                log.warn("TPU地址缺少有效端口：{}", tpu);
                return null;
            }
            InetSocketAddress address = new InetSocketAddress(hostAndPort.getHost(), hostAndPort.getPort());
            if (address.isUnresolved()) {
                log.warn("TPU地址无法解析：{}", tpu);
                return null;
            }
            return address;
        } catch (IllegalArgumentException e) {
            log.warn("TPU地址格式错误：{}", tpu, e);
            return null;
        }
    }
}
