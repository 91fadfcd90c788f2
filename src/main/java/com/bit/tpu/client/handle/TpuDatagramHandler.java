package com.bit.tpu.client.handle;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.socket.DatagramPacket;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;

/**
 * 发送通道的入站处理器
 * TPU 不回包，收到的数据一律记录后释放，防止内存泄漏
 */
@Slf4j
@ChannelHandler.Sharable
public class TpuDatagramHandler extends ChannelInboundHandlerAdapter {

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        try {
            if (msg instanceof DatagramPacket packet) {
                log.debug("发送通道收到意外的UDP数据包 | 来源：{} | 长度：{}",
                        packet.sender(), packet.content().readableBytes());
            }
        } finally {
            ReferenceCountUtil.release(msg);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        // UDP通道上的异常（如ICMP端口不可达）不影响后续发送，不关闭通道
        log.warn("TPU发送通道异常", cause);
    }
}
