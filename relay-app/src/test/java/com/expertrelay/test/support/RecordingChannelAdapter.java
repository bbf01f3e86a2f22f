package com.expertrelay.test.support;

import com.expertrelay.domain.conversation.model.entity.ConversationEntity;
import com.expertrelay.domain.delivery.adapter.gateway.IChannelAdapter;
import com.expertrelay.domain.delivery.model.valobj.DeliveryReceipt;
import com.expertrelay.domain.delivery.model.valobj.RenderedPayload;
import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.exception.AppException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 记录发送内容的渠道适配器，可模拟窗口状态与发送失败。
 */
public class RecordingChannelAdapter implements IChannelAdapter {

    private final List<RenderedPayload> sent = new ArrayList<>();
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private volatile boolean windowOpen = true;
    private volatile boolean windowCheckFails;

    public void setWindowOpen(boolean windowOpen) {
        this.windowOpen = windowOpen;
    }

    public void setWindowCheckFails(boolean windowCheckFails) {
        this.windowCheckFails = windowCheckFails;
    }

    public void failNext(int times) {
        failuresRemaining.set(times);
    }

    public synchronized List<RenderedPayload> sent() {
        return List.copyOf(sent);
    }

    public synchronized RenderedPayload last() {
        return sent.isEmpty() ? null : sent.get(sent.size() - 1);
    }

    @Override
    public boolean isFreeFormWindowOpen(ConversationEntity conversation) {
        if (windowCheckFails) {
            throw new IllegalStateException("window lookup failed");
        }
        return windowOpen;
    }

    @Override
    public DeliveryReceipt send(ConversationEntity conversation, RenderedPayload payload) {
        if (failuresRemaining.getAndUpdate(value -> Math.max(value - 1, 0)) > 0) {
            throw new AppException(ResponseCode.DELIVERY_FAILED, "bridge down");
        }
        synchronized (this) {
            sent.add(payload);
            return new DeliveryReceipt("msg-" + sent.size(), LocalDateTime.now());
        }
    }
}
