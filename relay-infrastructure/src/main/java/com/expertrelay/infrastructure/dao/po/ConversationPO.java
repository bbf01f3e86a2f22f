package com.expertrelay.infrastructure.dao.po;

import com.expertrelay.types.enums.ConversationStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 会话 PO
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationPO {

    /**
     * 会话 ID（channel:userExternalId）
     */
    private String id;

    private String channel;

    private String userExternalId;

    /**
     * 状态 (ACTIVE / EXPIRED)
     */
    private ConversationStatusEnum status;

    private String locale;

    private LocalDateTime lastInboundAt;

    private LocalDateTime lastOutboundAt;

    /**
     * 当前 Query ID (关联 relay_query.id)
     */
    private Long pendingQueryId;

    private String assignedExpertId;

    private Integer escalationLevel;

    private LocalDateTime lastUserReminderAt;

    private LocalDateTime expiredAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
