package com.bit.tpu.rpc;

import com.bit.tpu.rpc.dto.SlotUpdate;

import java.util.function.Consumer;

/**
 * slot 推送订阅，未配置推送端点时不提供实现
 */
public interface SlotUpdateSubscriber {

    Subscription subscribe(Consumer<SlotUpdate> handler);

    /**
     * 订阅句柄，关闭即退订
     */
    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
