package com.expertrelay.types.enums;

/**
 * 发给专家的通知类型。
 *
 * @author expertrelay
 * @since 2026-03-02
 */
public enum ReviewNoticeTypeEnum {

    /** 新的审核请求 */
    REVIEW_REQUEST,

    /** 审核提醒 */
    REMINDER,

    /** 升级转派给上级专家 */
    ESCALATED
}
