package com.expertrelay.domain.review.model.entity;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.util.Set;
import java.util.TreeSet;

/**
 * 审核任务领域实体
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Data
public class ReviewTaskEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * Query ID
     */
    private Long queryId;

    /**
     * 会话 ID
     */
    private String conversationId;

    /**
     * 当前负责专家
     */
    private String assignedExpertId;

    /**
     * 升级级别
     */
    private Integer escalationLevel;

    /**
     * 当前升级窗口开始时间
     */
    private LocalDateTime windowStartedAt;

    /**
     * 截止时间
     */
    private LocalDateTime deadline;

    /**
     * 已发送的提醒档位（百分比），默认跨升级窗口累计
     */
    private Set<Integer> sentReminderTiers;

    /**
     * 下一个提醒档位的触发时间，无待发档位时为 null
     */
    private LocalDateTime nextReminderAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static ReviewTaskEntity register(Long queryId, String conversationId, String expertId,
                                            LocalDateTime now, LocalDateTime deadline) {
        ReviewTaskEntity entity = new ReviewTaskEntity();
        entity.setQueryId(queryId);
        entity.setConversationId(conversationId);
        entity.setAssignedExpertId(expertId);
        entity.setEscalationLevel(0);
        entity.setWindowStartedAt(now);
        entity.setDeadline(deadline);
        entity.setSentReminderTiers(new TreeSet<>());
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    public void validate() {
        if (queryId == null) {
            throw new IllegalStateException("Query ID cannot be null");
        }
        if (StringUtils.isBlank(conversationId)) {
            throw new IllegalStateException("Conversation ID cannot be empty");
        }
        if (deadline == null || windowStartedAt == null) {
            throw new IllegalStateException("Review window cannot be null");
        }
        if (deadline.isBefore(windowStartedAt)) {
            throw new IllegalStateException("Deadline cannot be earlier than window start");
        }
    }

    public boolean isDue(LocalDateTime now) {
        return now != null && deadline != null && !deadline.isAfter(now);
    }

    public boolean isReminderSent(int tierPercent) {
        return sentReminderTiers != null && sentReminderTiers.contains(tierPercent);
    }

    public void markReminderSent(int tierPercent, LocalDateTime now) {
        if (sentReminderTiers == null) {
            sentReminderTiers = new TreeSet<>();
        }
        sentReminderTiers.add(tierPercent);
        this.updatedAt = now;
    }

    /**
     * 推进到下一升级窗口：级别与截止时间必须严格递增。
     * 已发送档位只有在 resetReminders 为 true 时清空。
     */
    public void advance(int level, String expertId, LocalDateTime now, LocalDateTime newDeadline, boolean resetReminders) {
        if (level <= normalizedEscalationLevel()) {
            throw new IllegalStateException("Escalation level must strictly increase");
        }
        if (newDeadline == null || (deadline != null && !newDeadline.isAfter(deadline))) {
            throw new IllegalStateException("Deadline must strictly increase");
        }
        this.escalationLevel = level;
        this.assignedExpertId = expertId;
        this.windowStartedAt = now;
        this.deadline = newDeadline;
        if (resetReminders || sentReminderTiers == null) {
            this.sentReminderTiers = new TreeSet<>();
        }
        this.updatedAt = now;
    }

    public int normalizedEscalationLevel() {
        return escalationLevel == null ? 0 : escalationLevel;
    }
}
