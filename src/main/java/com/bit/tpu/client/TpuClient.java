package com.bit.tpu.client;

import com.bit.tpu.client.handle.TpuDatagramHandler;
import com.bit.tpu.common.Commitment;
import com.bit.tpu.exception.ErrorType;
import com.bit.tpu.exception.TpuException;
import com.bit.tpu.leader.LeaderTpuService;
import com.bit.tpu.rpc.ClusterQueryClient;
import com.bit.tpu.rpc.SlotUpdateSubscriber;
import com.bit.tpu.structure.key.Keypair;
import com.bit.tpu.structure.tx.AbstractTransaction;
import com.bit.tpu.structure.tx.LegacyTransaction;
import com.bit.tpu.structure.tx.VersionedTransaction;
import com.bit.tpu.structure.tx.WireTransaction;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TPU 客户端：把已签名交易通过UDP直接发送给未来若干slot的领导者
 * 发送本身无状态，领导者信息全部来自 LeaderTpuService
 */
@Slf4j
public class TpuClient implements AutoCloseable {

    private final ClusterQueryClient client;
    @Getter
    private final LeaderTpuService leaderTpuService;
    @Getter
    private final int fanoutSlots;

    // 事件循环组（UDP无连接，仅需一个线程）
    private final NioEventLoopGroup eventLoopGroup;
    private final Channel sendChannel;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private TpuClient(ClusterQueryClient client, LeaderTpuService leaderTpuService, TpuClientConfig config) {
        this.client = client;
        this.leaderTpuService = leaderTpuService;
        this.fanoutSlots = config.clampedFanoutSlots();
        this.eventLoopGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("tpu-send", true));
        try {
            Bootstrap bootstrap = new Bootstrap();
            bootstrap.group(eventLoopGroup)
                    .channel(NioDatagramChannel.class)
                    .option(ChannelOption.SO_SNDBUF, 4 * 1024 * 1024) // 发送缓冲区，避免突发广播时丢包
                    .handler(new ChannelInitializer<NioDatagramChannel>() {
                        @Override
                        protected void initChannel(NioDatagramChannel ch) {
                            ch.pipeline().addLast(new TpuDatagramHandler());
                        }
                    });
            // 绑定随机端口
            this.sendChannel = bootstrap.bind(0).syncUninterruptibly().channel();
        } catch (RuntimeException e) {
            eventLoopGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            throw new TpuException(ErrorType.CONFIG_INVALID, "创建UDP发送通道失败", e);
        }
        log.info("TPU客户端已启动，本地地址：{}，fanoutSlots：{}", sendChannel.localAddress(), fanoutSlots);
    }

    /**
     * 加载领导者服务并创建客户端
     * @param subscriber slot推送，未配置时传null
     */
    public static TpuClient load(ClusterQueryClient client, SlotUpdateSubscriber subscriber, TpuClientConfig config) {
        LeaderTpuService leaderTpuService = LeaderTpuService.load(client, subscriber, config);
        try {
            return new TpuClient(client, leaderTpuService, config);
        } catch (RuntimeException e) {
            leaderTpuService.close();
            throw e;
        }
    }

    /**
     * 使用已加载的领导者服务创建客户端，客户端关闭时一并关闭该服务
     */
    public static TpuClient create(ClusterQueryClient client, LeaderTpuService leaderTpuService, TpuClientConfig config) {
        return new TpuClient(client, leaderTpuService, config);
    }

    /**
     * 已签名的版本化交易
     */
    public CompletableFuture<String> sendTransaction(VersionedTransaction transaction) {
        return sendTransaction(transaction, null);
    }

    /**
     * 发送交易
     * legacy交易必须提供签名者：无nonce时先获取最近区块哈希再签名；
     * 版本化交易必须已签名，且不能再传入签名者
     * 参数不匹配时在任何网络请求之前失败
     */
    public CompletableFuture<String> sendTransaction(AbstractTransaction transaction, List<Keypair> signers) {
        byte[] rawTransaction;
        try {
            if (transaction instanceof VersionedTransaction versioned) {
                if (signers != null && !signers.isEmpty()) {
                    throw new TpuException(ErrorType.INVALID_ARGUMENTS, "版本化交易不接受额外的签名者");
                }
                rawTransaction = versioned.serialize();
            } else if (transaction instanceof LegacyTransaction legacy) {
                if (signers == null || signers.isEmpty()) {
                    throw new TpuException(ErrorType.INVALID_ARGUMENTS, "legacy交易必须提供签名者");
                }
                if (legacy.getNonceInfo() == null) {
                    legacy.setRecentBlockhash(client.getLatestBlockhash(Commitment.CONFIRMED).getBlockhash());
                }
                legacy.sign(signers);
                rawTransaction = legacy.serialize();
            } else {
                throw new TpuException(ErrorType.INVALID_ARGUMENTS, "不支持的交易类型：" + transaction);
            }
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return sendRawTransaction(rawTransaction);
    }

    /**
     * 把原始交易字节发送给未来 fanoutSlots 个slot的领导者
     * 每个地址独立发送，全部发送结束后：至少一个成功即返回交易签名（base58），全部失败才失败
     */
    public CompletableFuture<String> sendRawTransaction(byte[] rawTransaction) {
        String signature;
        List<InetSocketAddress> tpuAddresses;
        try {
            if (closed.get()) {
                throw new TpuException(ErrorType.SEND_FAILED, "TPU客户端已关闭");
            }
            if (rawTransaction.length > WireTransaction.PACKET_DATA_SIZE) {
                throw new TpuException(ErrorType.INVALID_TRANSACTION,
                        "交易大小" + rawTransaction.length + "字节，超过上限" + WireTransaction.PACKET_DATA_SIZE + "字节");
            }
            signature = WireTransaction.decode(rawTransaction).firstSignature().toBase58();
            tpuAddresses = leaderTpuService.leaderTpuSockets(fanoutSlots);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (tpuAddresses.isEmpty()) {
            return CompletableFuture.failedFuture(
                    new TpuException(ErrorType.NO_LEADER_AVAILABLE, "未来" + fanoutSlots + "个slot内没有可用的TPU地址"));
        }

        CompletableFuture<String> result = new CompletableFuture<>();
        AtomicInteger remaining = new AtomicInteger(tpuAddresses.size());
        AtomicInteger succeeded = new AtomicInteger();
        Queue<Throwable> failures = new ConcurrentLinkedQueue<>();

        for (InetSocketAddress tpuAddress : tpuAddresses) {
            log.info("发送交易到TPU地址 {}", tpuAddress);
            DatagramPacket packet = new DatagramPacket(Unpooled.wrappedBuffer(rawTransaction), tpuAddress);
            sendChannel.writeAndFlush(packet).addListener(future -> {
                if (future.isSuccess()) {
                    succeeded.incrementAndGet();
                } else {
                    log.warn("发送交易到TPU地址 {} 失败", tpuAddress, future.cause());
                    failures.add(future.cause());
                }
                if (remaining.decrementAndGet() == 0) {
                    complete(result, signature, tpuAddresses.size(), succeeded.get(), failures);
                }
            });
        }
        return result;
    }

    private static void complete(CompletableFuture<String> result, String signature, int total, int succeeded,
                                 Queue<Throwable> failures) {
        if (succeeded > 0) {
            log.info("交易已发送：{}（成功{}/{}）", signature, succeeded, total);
            result.complete(signature);
            return;
        }
        TpuException error = new TpuException(ErrorType.SEND_FAILED, "交易 " + signature + " 发送到全部" + total + "个TPU地址均失败");
        for (Throwable failure : failures) {
            error.addSuppressed(failure);
        }
        result.completeExceptionally(error);
    }

    public InetSocketAddress localAddress() {
        return (InetSocketAddress) sendChannel.localAddress();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        leaderTpuService.close();
        sendChannel.close().syncUninterruptibly();
        eventLoopGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS)
                .addListener(future -> log.info("TPU发送EventLoopGroup已关闭"));
    }
}
