package com.expertrelay.domain.review.model.valobj;

import com.expertrelay.types.enums.ReviewNoticeTypeEnum;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 发给专家的审核通知（审核请求、提醒、升级转交）。
 * <p>
 * REMINDER 按专家合并：一次调度内同一专家只收到一条，顶层字段取截止时间最早的一项，
 * {@code pendingReviews} 按截止时间列出全部到点的待审核问题。
 * </p>
 */
@Data
@Builder
public class ReviewNotice {

    private ReviewNoticeTypeEnum type;

    private Long queryId;

    private String conversationId;

    private Integer escalationLevel;

    /** 提醒档位，仅 REMINDER 有值 */
    private Integer reminderTierPercent;

    private LocalDateTime deadline;

    /** 审核包文本 */
    private String reviewPacket;

    /** 合并提醒中的各项，仅 REMINDER 有值 */
    private List<ReviewNotice> pendingReviews;
}
