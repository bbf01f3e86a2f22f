package com.expertrelay.infrastructure.dao.po;

import com.expertrelay.types.enums.ContentCategoryEnum;
import com.expertrelay.types.enums.DeliveryModeEnum;
import com.expertrelay.types.enums.DeliveryStateEnum;
import com.expertrelay.types.enums.QueryCloseReasonEnum;
import com.expertrelay.types.enums.QueryStatusEnum;
import com.expertrelay.types.enums.ReviewOutcomeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 问题 PO
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryPO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 会话 ID (关联 relay_conversation.id)
     */
    private String conversationId;

    private String rawText;

    private String normalizedText;

    private String locale;

    private QueryStatusEnum status;

    /**
     * 检索候选 (JSONB 数组)
     */
    private String candidates;

    /**
     * 选中候选 (JSONB)
     */
    private String chosenCandidate;

    private String draftAnswer;

    private String reviewPacket;

    private String finalAnswer;

    private ReviewOutcomeEnum reviewOutcome;

    private String expertNote;

    private String actedByExpertId;

    private LocalDateTime actedAt;

    private Integer escalationLevel;

    private String assignedExpertId;

    private QueryCloseReasonEnum closeReason;

    private DeliveryStateEnum deliveryState;

    private ContentCategoryEnum pendingCategory;

    private DeliveryModeEnum deliveryMode;

    private String deliveryTemplate;

    private Integer deliveryAttempts;

    private String lastDeliveryError;

    private LocalDateTime deliveredAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * 乐观锁版本号
     */
    private Integer version;
}
