package com.bit.tpu.rpc.impl;

import com.bit.tpu.exception.ErrorType;
import com.bit.tpu.exception.TpuException;
import com.bit.tpu.rpc.SlotUpdateSubscriber;
import com.bit.tpu.rpc.dto.SlotUpdate;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 通过节点 WebSocket 订阅 slotsUpdatesSubscribe
 * 每次订阅独占一个连接和一个事件循环线程；连接断开后按固定延迟重连并重新订阅，直到退订
 */
@Slf4j
public class WebSocketSlotSubscriber implements SlotUpdateSubscriber {

    private static final int MAX_FRAME_SIZE = 1 << 20;
    private static final int CONNECT_TIMEOUT_MS = 10_000;
    static final long DEFAULT_RECONNECT_DELAY_MS = 1000;

    private final URI uri;
    private final ObjectMapper objectMapper;
    private final long reconnectDelayMs;
    private final String host;
    private final int port;
    private final SslContext sslContext;

    public WebSocketSlotSubscriber(String websocketUrl) {
        this(URI.create(websocketUrl), new ObjectMapper());
    }

    public WebSocketSlotSubscriber(URI uri, ObjectMapper objectMapper) {
        this(uri, objectMapper, DEFAULT_RECONNECT_DELAY_MS);
    }

    WebSocketSlotSubscriber(URI uri, ObjectMapper objectMapper, long reconnectDelayMs) {
        String scheme = uri.getScheme();
        if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
            throw new TpuException(ErrorType.CONFIG_INVALID, "WebSocket地址必须以ws://或wss://开头：" + uri);
        }
        this.uri = uri;
        this.objectMapper = objectMapper;
        this.reconnectDelayMs = reconnectDelayMs;
        boolean ssl = "wss".equalsIgnoreCase(scheme);
        this.host = uri.getHost();
        this.port = uri.getPort() != -1 ? uri.getPort() : (ssl ? 443 : 80);
        this.sslContext = ssl ? buildSslContext() : null;
    }

    /**
     * 首次连接同步完成，失败直接抛出 RPC_FAILED；之后的断线重连在后台进行
     */
    @Override
    public Subscription subscribe(Consumer<SlotUpdate> handler) {
        NioEventLoopGroup group = new NioEventLoopGroup(1, new DefaultThreadFactory("slot-updates-ws", true));
        SlotSubscription subscription = new SlotSubscription(group, handler);
        try {
            subscription.connectBlocking();
        } catch (Exception e) {
            // connect/sync 会把受检异常原样抛出，这里统一转换
            subscription.close();
            throw new TpuException(ErrorType.RPC_FAILED, "连接slot推送失败：" + uri, e);
        }
        return subscription;
    }

    private Bootstrap bootstrap(NioEventLoopGroup group, SlotUpdateHandler slotUpdateHandler) {
        return new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        if (sslContext != null) {
                            pipeline.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        pipeline.addLast(new HttpClientCodec());
                        pipeline.addLast(new HttpObjectAggregator(8192));
                        pipeline.addLast(slotUpdateHandler);
                    }
                });
    }

    private String request(long id, String method, Object... params) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("jsonrpc", "2.0");
        body.put("id", id);
        body.put("method", method);
        body.set("params", objectMapper.valueToTree(params));
        return body.toString();
    }

    private static SslContext buildSslContext() {
        try {
            return SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new TpuException(ErrorType.CONFIG_INVALID, "初始化TLS失败", e);
        }
    }

    /**
     * 一个订阅：持有当前连接，断线后在自己的事件循环上延迟重连
     */
    private class SlotSubscription implements Subscription {

        private final NioEventLoopGroup group;
        private final Consumer<SlotUpdate> handler;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private volatile Channel channel;
        private volatile SlotUpdateHandler slotUpdateHandler;

        SlotSubscription(NioEventLoopGroup group, Consumer<SlotUpdate> handler) {
            this.group = group;
            this.handler = handler;
        }

        private SlotUpdateHandler newHandler() {
            return new SlotUpdateHandler(
                    WebSocketClientHandshakerFactory.newHandshaker(uri, WebSocketVersion.V13, null, true,
                            new DefaultHttpHeaders(), MAX_FRAME_SIZE),
                    objectMapper, handler, this::onDisconnected);
        }

        void connectBlocking() {
            SlotUpdateHandler newHandler = newHandler();
            Channel connected = bootstrap(group, newHandler).connect(host, port).syncUninterruptibly().channel();
            channel = connected;
            newHandler.handshakeFuture().syncUninterruptibly();
            sendSubscribe(connected, newHandler);
        }

        private void connectAsync() {
            if (closed.get()) {
                return;
            }
            SlotUpdateHandler newHandler = newHandler();
            bootstrap(group, newHandler).connect(host, port).addListener((ChannelFutureListener) future -> {
                if (!future.isSuccess()) {
                    log.warn("slot推送重连失败：{}", uri, future.cause());
                    scheduleReconnect();
                    return;
                }
                Channel connected = future.channel();
                channel = connected;
                newHandler.handshakeFuture().addListener(handshake -> {
                    if (handshake.isSuccess()) {
                        sendSubscribe(connected, newHandler);
                    } else {
                        // 关闭连接会触发 channelInactive，由其安排下一次重连
                        connected.close();
                    }
                });
            });
        }

        private void sendSubscribe(Channel connected, SlotUpdateHandler connectedHandler) {
            if (closed.get()) {
                connected.close();
                return;
            }
            slotUpdateHandler = connectedHandler;
            connected.writeAndFlush(new TextWebSocketFrame(request(1, "slotsUpdatesSubscribe")));
            log.info("已发送slot推送订阅请求：{}", uri);
        }

        private void onDisconnected() {
            if (closed.get()) {
                return;
            }
            log.warn("slot推送连接断开，{}ms后重连：{}", reconnectDelayMs, uri);
            scheduleReconnect();
        }

        private void scheduleReconnect() {
            if (closed.get()) {
                return;
            }
            try {
                group.schedule(this::connectAsync, reconnectDelayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("事件循环已关闭，放弃重连：{}", uri);
            }
        }

        /**
         * 退订并关闭连接，可重复调用
         */
        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            Channel current = channel;
            if (current != null) {
                SlotUpdateHandler currentHandler = slotUpdateHandler;
                Long subscriptionId = currentHandler == null ? null : currentHandler.getSubscriptionId();
                if (current.isActive()) {
                    if (subscriptionId != null) {
                        current.writeAndFlush(new TextWebSocketFrame(request(2, "slotsUpdatesUnsubscribe", subscriptionId)));
                    }
                    current.writeAndFlush(new CloseWebSocketFrame());
                }
                ChannelFuture closeFuture = current.close();
                closeFuture.awaitUninterruptibly(1, TimeUnit.SECONDS);
            }
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            log.info("slot推送已退订");
        }
    }
}
