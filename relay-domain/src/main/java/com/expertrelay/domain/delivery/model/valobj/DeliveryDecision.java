package com.expertrelay.domain.delivery.model.valobj;

import com.expertrelay.types.enums.DeliveryModeEnum;

/**
 * 下发方式决策。只在发送时计算，不单独持久化。
 */
public record DeliveryDecision(DeliveryModeEnum mode, RenderedPayload payload) {
}
