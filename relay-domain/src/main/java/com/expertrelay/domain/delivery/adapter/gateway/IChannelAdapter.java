package com.expertrelay.domain.delivery.adapter.gateway;

import com.expertrelay.domain.conversation.model.entity.ConversationEntity;
import com.expertrelay.domain.delivery.model.valobj.DeliveryReceipt;
import com.expertrelay.domain.delivery.model.valobj.RenderedPayload;

/**
 * 渠道适配器网关。
 */
public interface IChannelAdapter {

    /**
     * 会话当前是否处于渠道允许自由文本的窗口内。
     */
    boolean isFreeFormWindowOpen(ConversationEntity conversation);

    /**
     * 发送消息。
     *
     * @throws com.expertrelay.types.exception.AppException DELIVERY_FAILED 重试耗尽后
     */
    DeliveryReceipt send(ConversationEntity conversation, RenderedPayload payload);
}
