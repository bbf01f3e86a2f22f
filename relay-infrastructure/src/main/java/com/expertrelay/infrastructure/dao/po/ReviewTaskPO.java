package com.expertrelay.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 审核任务 PO
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewTaskPO {

    private Long id;

    /**
     * Query ID (唯一)
     */
    private Long queryId;

    private String conversationId;

    private String assignedExpertId;

    private Integer escalationLevel;

    private LocalDateTime windowStartedAt;

    private LocalDateTime deadline;

    /**
     * 已发送提醒档位 (JSONB 数组)
     */
    private String sentReminderTiers;

    /**
     * 下一提醒时间，无待发档位为 null
     */
    private LocalDateTime nextReminderAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
