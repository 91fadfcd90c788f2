package com.bit.tpu.rpc.impl;

import com.bit.tpu.rpc.dto.SlotUpdate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;

/**
 * slotsUpdatesSubscribe 的 WebSocket 处理器：完成握手后解析推送并交给回调
 */
@Slf4j
public class SlotUpdateHandler extends SimpleChannelInboundHandler<Object> {

    public static final String NOTIFICATION_METHOD = "slotsUpdatesNotification";

    private final WebSocketClientHandshaker handshaker;
    private final ObjectMapper objectMapper;
    private final Consumer<SlotUpdate> consumer;
    private ChannelPromise handshakeFuture;

    // 订阅成功后节点返回的订阅ID，退订时使用
    private volatile Long subscriptionId;

    // 连接断开回调，由订阅方决定是否重连
    private final Runnable onDisconnected;

    public SlotUpdateHandler(WebSocketClientHandshaker handshaker, ObjectMapper objectMapper, Consumer<SlotUpdate> consumer,
                             Runnable onDisconnected) {
        this.handshaker = handshaker;
        this.objectMapper = objectMapper;
        this.consumer = consumer;
        this.onDisconnected = onDisconnected;
    }

    public ChannelFuture handshakeFuture() {
        return handshakeFuture;
    }

    public Long getSubscriptionId() {
        return subscriptionId;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        handshakeFuture = ctx.newPromise();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        log.warn("slot推送连接已断开");
        if (!handshakeFuture.isDone()) {
            handshakeFuture.setFailure(new IllegalStateException("握手完成前连接已断开"));
        }
        onDisconnected.run();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        Channel ch = ctx.channel();
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ch, (FullHttpResponse) msg);
                log.info("slot推送WebSocket握手完成");
                handshakeFuture.setSuccess();
            } catch (RuntimeException e) {
                log.error("slot推送WebSocket握手失败", e);
                handshakeFuture.setFailure(e);
            }
            return;
        }

        if (msg instanceof FullHttpResponse response) {
            throw new IllegalStateException("握手完成后收到意外的HTTP响应，状态：" + response.status());
        }

        WebSocketFrame frame = (WebSocketFrame) msg;
        if (frame instanceof TextWebSocketFrame textFrame) {
            handleText(textFrame.text());
        } else if (frame instanceof PingWebSocketFrame) {
            ch.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
        } else if (frame instanceof CloseWebSocketFrame) {
            log.info("节点关闭了slot推送连接");
            ch.close();
        }
    }

    /**
     * 处理一条文本消息：订阅确认记录订阅ID，slot推送交给回调，其余忽略
     */
    void handleText(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("slot推送消息无法解析：{}", text);
            return;
        }
        if (NOTIFICATION_METHOD.equals(root.path("method").asText())) {
            JsonNode result = root.path("params").path("result");
            SlotUpdate update;
            try {
                update = objectMapper.treeToValue(result, SlotUpdate.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.debug("忽略无法识别的slot推送：{}", result);
                return;
            }
            consumer.accept(update);
            return;
        }
        if (root.has("error")) {
            log.error("slot推送订阅返回错误：{}", root.get("error"));
            return;
        }
        JsonNode result = root.get("result");
        if (result != null && result.isNumber()) {
            subscriptionId = result.asLong();
            log.info("slot推送订阅成功，订阅ID：{}", subscriptionId);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("slot推送连接异常", cause);
        if (!handshakeFuture.isDone()) {
            handshakeFuture.setFailure(cause);
        }
        ctx.close();
    }
}
