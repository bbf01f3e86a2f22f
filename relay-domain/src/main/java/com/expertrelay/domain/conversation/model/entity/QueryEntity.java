package com.expertrelay.domain.conversation.model.entity;

import com.expertrelay.domain.knowledge.model.valobj.DraftAnswer;
import com.expertrelay.domain.knowledge.model.valobj.RetrievedCandidate;
import com.expertrelay.types.enums.ContentCategoryEnum;
import com.expertrelay.types.enums.DeliveryModeEnum;
import com.expertrelay.types.enums.DeliveryStateEnum;
import com.expertrelay.types.enums.QueryCloseReasonEnum;
import com.expertrelay.types.enums.QueryStatusEnum;
import com.expertrelay.types.enums.ReviewOutcomeEnum;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 用户问题（Query）领域实体
 * <p>
 * 状态迁移：RECEIVED → RETRIEVING → PENDING_REVIEW → {APPROVED, EDITED, REJECTED} → DELIVERED，
 * 以及 PENDING_REVIEW → EXPIRED。审核结果一旦离开 PENDING 即不可再变。
 * </p>
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Data
public class QueryEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 所属会话 ID
     */
    private String conversationId;

    /**
     * 原始问题文本
     */
    private String rawText;

    /**
     * 归一化问题文本
     */
    private String normalizedText;

    /**
     * 问题语言
     */
    private String locale;

    /**
     * 状态
     */
    private QueryStatusEnum status;

    /**
     * 检索候选（按相关度排序，设置后不可变）
     */
    private List<RetrievedCandidate> candidates;

    /**
     * 被选中的候选
     */
    private RetrievedCandidate chosenCandidate;

    /**
     * 草稿答案
     */
    private String draftAnswer;

    /**
     * 审核包
     */
    private String reviewPacket;

    /**
     * 最终答案（批准时等于草稿，修改时为专家文本）
     */
    private String finalAnswer;

    /**
     * 审核结果
     */
    private ReviewOutcomeEnum reviewOutcome;

    /**
     * 专家备注（拒绝原因等）
     */
    private String expertNote;

    /**
     * 执行审核动作的专家
     */
    private String actedByExpertId;

    /**
     * 审核动作时间
     */
    private LocalDateTime actedAt;

    /**
     * 升级级别（与审核任务保持一致）
     */
    private Integer escalationLevel;

    /**
     * 当前负责专家（与审核任务保持一致）
     */
    private String assignedExpertId;

    /**
     * 关闭原因
     */
    private QueryCloseReasonEnum closeReason;

    /**
     * 投递状态
     */
    private DeliveryStateEnum deliveryState;

    /**
     * 待投递消息类别
     */
    private ContentCategoryEnum pendingCategory;

    /**
     * 实际投递方式
     */
    private DeliveryModeEnum deliveryMode;

    /**
     * 实际使用的模板名
     */
    private String deliveryTemplate;

    /**
     * 投递尝试次数
     */
    private Integer deliveryAttempts;

    /**
     * 最近一次投递错误
     */
    private String lastDeliveryError;

    /**
     * 投递成功时间
     */
    private LocalDateTime deliveredAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * 乐观锁版本号
     */
    private Integer version;

    public static QueryEntity receive(String conversationId, String rawText, String normalizedText,
                                      String locale, LocalDateTime now) {
        QueryEntity entity = new QueryEntity();
        entity.setConversationId(conversationId);
        entity.setRawText(rawText);
        entity.setNormalizedText(normalizedText);
        entity.setLocale(locale);
        entity.setStatus(QueryStatusEnum.RECEIVED);
        entity.setReviewOutcome(ReviewOutcomeEnum.PENDING);
        entity.setCandidates(Collections.emptyList());
        entity.setEscalationLevel(0);
        entity.setDeliveryState(DeliveryStateEnum.NONE);
        entity.setDeliveryAttempts(0);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        entity.setVersion(0);
        return entity;
    }

    public void validate() {
        if (StringUtils.isBlank(conversationId)) {
            throw new IllegalStateException("Conversation ID cannot be empty");
        }
        if (StringUtils.isBlank(normalizedText)) {
            throw new IllegalStateException("Query text cannot be empty");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
        if (reviewOutcome == null) {
            throw new IllegalStateException("Review outcome cannot be null");
        }
    }

    public void startRetrieval(LocalDateTime now) {
        if (status != QueryStatusEnum.RECEIVED) {
            throw new IllegalStateException("Query must be in RECEIVED status to start retrieval");
        }
        this.status = QueryStatusEnum.RETRIEVING;
        this.updatedAt = now;
    }

    /**
     * 检索成功，进入待审核。
     */
    public void awaitReview(List<RetrievedCandidate> ranked, DraftAnswer draft, String expertId, LocalDateTime now) {
        if (status != QueryStatusEnum.RETRIEVING) {
            throw new IllegalStateException("Query must be in RETRIEVING status to await review");
        }
        if (ranked == null || ranked.isEmpty()) {
            throw new IllegalStateException("Candidates cannot be empty when awaiting review");
        }
        this.candidates = Collections.unmodifiableList(new ArrayList<>(ranked));
        this.chosenCandidate = draft.chosen();
        this.draftAnswer = draft.text();
        this.reviewPacket = draft.reviewPacket();
        this.assignedExpertId = expertId;
        this.escalationLevel = 0;
        this.status = QueryStatusEnum.PENDING_REVIEW;
        this.updatedAt = now;
    }

    /**
     * 检索失败、无候选或检索阶段滞留：直接关闭并等待投递道歉消息。
     */
    public void rejectNoAnswer(LocalDateTime now) {
        if (!isRetrievalOpen()) {
            throw new IllegalStateException("Query must be in RECEIVED or RETRIEVING status to be rejected without answer");
        }
        this.status = QueryStatusEnum.REJECTED;
        this.reviewOutcome = ReviewOutcomeEnum.REJECTED;
        this.closeReason = QueryCloseReasonEnum.NO_ANSWER_AVAILABLE;
        this.updatedAt = now;
        requestDelivery(ContentCategoryEnum.NO_ANSWER_APOLOGY);
    }

    public void approve(String expertId, LocalDateTime now) {
        ensurePendingReview();
        this.reviewOutcome = ReviewOutcomeEnum.APPROVED;
        this.finalAnswer = draftAnswer;
        this.status = QueryStatusEnum.APPROVED;
        markActed(expertId, now);
        requestDelivery(ContentCategoryEnum.VERIFIED_ANSWER);
    }

    public void edit(String expertId, String editedText, LocalDateTime now) {
        ensurePendingReview();
        if (StringUtils.isBlank(editedText)) {
            throw new IllegalStateException("Edited text cannot be empty");
        }
        this.reviewOutcome = ReviewOutcomeEnum.EDITED;
        this.finalAnswer = editedText.trim();
        this.status = QueryStatusEnum.EDITED;
        markActed(expertId, now);
        requestDelivery(ContentCategoryEnum.CORRECTED_ANSWER);
    }

    public void reject(String expertId, String note, LocalDateTime now) {
        ensurePendingReview();
        this.reviewOutcome = ReviewOutcomeEnum.REJECTED;
        this.expertNote = StringUtils.trimToNull(note);
        this.closeReason = QueryCloseReasonEnum.EXPERT_REJECTED;
        this.status = QueryStatusEnum.REJECTED;
        markActed(expertId, now);
        requestDelivery(ContentCategoryEnum.REJECTED_ANSWER);
    }

    /**
     * 升级：级别必须严格递增。
     */
    public void escalateTo(int level, String expertId, LocalDateTime now) {
        ensurePendingReview();
        if (level <= normalizedEscalationLevel()) {
            throw new IllegalStateException("Escalation level must strictly increase");
        }
        this.escalationLevel = level;
        this.assignedExpertId = expertId;
        this.updatedAt = now;
    }

    public void expire(LocalDateTime now) {
        ensurePendingReview();
        this.status = QueryStatusEnum.EXPIRED;
        this.closeReason = QueryCloseReasonEnum.REVIEW_EXPIRED;
        this.updatedAt = now;
        requestDelivery(ContentCategoryEnum.STILL_WORKING);
    }

    /**
     * 投递成功。专家结论迁移到 DELIVERED；无答案关闭与过期保持原终态，仅记录已发送。
     */
    public void markDelivered(DeliveryModeEnum mode, String templateName, LocalDateTime now) {
        if (deliveryState != DeliveryStateEnum.PENDING) {
            throw new IllegalStateException("Query has no pending delivery");
        }
        if (status == QueryStatusEnum.APPROVED
                || status == QueryStatusEnum.EDITED
                || (status == QueryStatusEnum.REJECTED && closeReason == QueryCloseReasonEnum.EXPERT_REJECTED)) {
            this.status = QueryStatusEnum.DELIVERED;
        }
        this.deliveryState = DeliveryStateEnum.SENT;
        this.deliveryMode = mode;
        this.deliveryTemplate = templateName;
        this.deliveryAttempts = normalizedDeliveryAttempts() + 1;
        this.lastDeliveryError = null;
        this.deliveredAt = now;
        this.updatedAt = now;
    }

    public void recordDeliveryFailure(String error, LocalDateTime now) {
        if (deliveryState != DeliveryStateEnum.PENDING) {
            throw new IllegalStateException("Query has no pending delivery");
        }
        this.deliveryAttempts = normalizedDeliveryAttempts() + 1;
        this.lastDeliveryError = StringUtils.abbreviate(error, 512);
        this.updatedAt = now;
    }

    /**
     * 是否仍处于检索阶段（尚未产生审核结论）。
     */
    public boolean isRetrievalOpen() {
        return status == QueryStatusEnum.RECEIVED || status == QueryStatusEnum.RETRIEVING;
    }

    public boolean isPendingReview() {
        return status == QueryStatusEnum.PENDING_REVIEW;
    }

    /**
     * 是否仍占用会话（未完成或尚有待投递消息）。
     */
    public boolean isOpen() {
        return status != null && !status.isTerminal();
    }

    public boolean hasPendingDelivery() {
        return deliveryState == DeliveryStateEnum.PENDING;
    }

    public int normalizedEscalationLevel() {
        return escalationLevel == null ? 0 : escalationLevel;
    }

    public int normalizedDeliveryAttempts() {
        return deliveryAttempts == null ? 0 : deliveryAttempts;
    }

    public int normalizedVersion() {
        return version == null ? 0 : version;
    }

    public void incrementVersion() {
        this.version = normalizedVersion() + 1;
    }

    private void ensurePendingReview() {
        if (status != QueryStatusEnum.PENDING_REVIEW) {
            throw new IllegalStateException("Query must be in PENDING_REVIEW status, current: " + status);
        }
    }

    private void markActed(String expertId, LocalDateTime now) {
        this.actedByExpertId = expertId;
        this.actedAt = now;
        this.updatedAt = now;
    }

    private void requestDelivery(ContentCategoryEnum category) {
        this.pendingCategory = category;
        this.deliveryState = DeliveryStateEnum.PENDING;
    }
}
