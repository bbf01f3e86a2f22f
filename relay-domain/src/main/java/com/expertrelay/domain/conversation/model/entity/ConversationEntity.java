package com.expertrelay.domain.conversation.model.entity;

import com.expertrelay.domain.conversation.model.valobj.ConversationKey;
import com.expertrelay.types.common.Constants;
import com.expertrelay.types.enums.ConversationStatusEnum;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;

/**
 * 会话领域实体
 * <p>
 * 最近一次收/发消息时间以本实体为唯一事实来源，只由编排核心写入。
 * </p>
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Data
public class ConversationEntity {

    /**
     * 会话 ID（channel:userExternalId）
     */
    private String id;

    /**
     * 渠道
     */
    private String channel;

    /**
     * 用户外部标识
     */
    private String userExternalId;

    /**
     * 会话状态
     */
    private ConversationStatusEnum status;

    /**
     * 语言标签
     */
    private String locale;

    /**
     * 最近一次用户消息时间
     */
    private LocalDateTime lastInboundAt;

    /**
     * 最近一次下发消息时间
     */
    private LocalDateTime lastOutboundAt;

    /**
     * 当前（最近一个）Query ID
     */
    private Long pendingQueryId;

    /**
     * 当前负责审核的专家
     */
    private String assignedExpertId;

    /**
     * 当前审核升级级别
     */
    private Integer escalationLevel;

    /**
     * 最近一次空闲提醒时间
     */
    private LocalDateTime lastUserReminderAt;

    /**
     * 过期时间
     */
    private LocalDateTime expiredAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static ConversationEntity open(ConversationKey key, String locale, LocalDateTime now) {
        ConversationEntity entity = new ConversationEntity();
        entity.setId(key.conversationId());
        entity.setChannel(key.channel());
        entity.setUserExternalId(key.userExternalId());
        entity.setStatus(ConversationStatusEnum.ACTIVE);
        entity.setLocale(StringUtils.defaultIfBlank(locale, Constants.DEFAULT_LOCALE));
        entity.setEscalationLevel(0);
        entity.setLastInboundAt(now);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    public void validate() {
        if (StringUtils.isBlank(id)) {
            throw new IllegalStateException("Conversation ID cannot be empty");
        }
        if (StringUtils.isBlank(channel) || StringUtils.isBlank(userExternalId)) {
            throw new IllegalStateException("Conversation channel and user cannot be empty");
        }
        if (status == null) {
            throw new IllegalStateException("Conversation status cannot be null");
        }
    }

    public boolean isActive() {
        return status == ConversationStatusEnum.ACTIVE;
    }

    /**
     * 是否自 threshold 起没有用户消息。
     */
    public boolean isIdleSince(LocalDateTime threshold) {
        if (threshold == null) {
            return false;
        }
        LocalDateTime lastActivity = lastInboundAt == null ? createdAt : lastInboundAt;
        return lastActivity != null && lastActivity.isBefore(threshold);
    }

    /**
     * 最近一次用户消息之后是否已发送过空闲提醒。
     */
    public boolean isRemindedSinceLastInbound() {
        if (lastUserReminderAt == null) {
            return false;
        }
        return lastInboundAt == null || !lastUserReminderAt.isBefore(lastInboundAt);
    }

    public String resolvedLocale() {
        return StringUtils.defaultIfBlank(locale, Constants.DEFAULT_LOCALE);
    }
}
