package com.expertrelay.domain.delivery.model.valobj;

import java.time.LocalDateTime;

/**
 * 渠道发送回执。
 *
 * @param providerMessageId 渠道消息 ID
 * @param sentAt            发送时间
 */
public record DeliveryReceipt(String providerMessageId, LocalDateTime sentAt) {
}
