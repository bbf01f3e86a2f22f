package com.expertrelay.types.enums;

/**
 * 会话状态。会话不会被物理删除，长期无互动时标记为 EXPIRED，用户再次发消息后恢复 ACTIVE。
 *
 * @author expertrelay
 * @since 2026-03-02
 */
public enum ConversationStatusEnum {

    ACTIVE,

    EXPIRED
}
