package com.expertrelay.types.enums;

/**
 * Query 投递进度。PENDING 表示有待发送（或发送失败待重投）的消息。
 *
 * @author expertrelay
 * @since 2026-03-02
 */
public enum DeliveryStateEnum {

    NONE,

    PENDING,

    SENT
}
