package com.expertrelay.trigger.application.command;

import com.expertrelay.domain.conversation.adapter.repository.IConversationRepository;
import com.expertrelay.domain.conversation.adapter.repository.IQueryRepository;
import com.expertrelay.domain.conversation.model.entity.ConversationEntity;
import com.expertrelay.domain.conversation.model.entity.QueryEntity;
import com.expertrelay.domain.conversation.model.valobj.ConversationKey;
import com.expertrelay.domain.conversation.model.valobj.QueryHandle;
import com.expertrelay.domain.conversation.service.QueryTransitionDomainService;
import com.expertrelay.domain.conversation.service.QueryTransitionDomainService.DecisionCheck;
import com.expertrelay.domain.feedback.model.valobj.CorrectionRecord;
import com.expertrelay.domain.feedback.service.CorrectionFeedbackDomainService;
import com.expertrelay.domain.knowledge.adapter.gateway.IKnowledgeRetriever;
import com.expertrelay.domain.knowledge.model.valobj.DraftAnswer;
import com.expertrelay.domain.knowledge.model.valobj.RetrievalOptions;
import com.expertrelay.domain.knowledge.model.valobj.RetrievedCandidate;
import com.expertrelay.domain.knowledge.service.AnswerComposerDomainService;
import com.expertrelay.domain.review.adapter.gateway.IReminderSink;
import com.expertrelay.domain.review.model.entity.ReviewTaskEntity;
import com.expertrelay.domain.review.model.valobj.ReviewNotice;
import com.expertrelay.domain.review.service.EscalationPolicyDomainService;
import com.expertrelay.trigger.application.common.QueryLockRegistry;
import com.expertrelay.types.enums.ExpertDecisionEnum;
import com.expertrelay.types.enums.QueryStatusEnum;
import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.enums.ReviewNoticeTypeEnum;
import com.expertrelay.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Query 审核状态机写用例：提交、专家审核、升级、过期与重新投递。
 * <p>
 * 同一 Query 的所有迁移在 Query 迁移锁内串行执行，先拿到锁的动作生效，
 * 其余动作在锁内重新读取状态后成为 STALE 空操作。
 * 调度器触发的动作（升级、过期、重新投递）只做限时加锁，拿不到锁留待下一轮。
 * </p>
 */
@Slf4j
@Service
public class QueryVerificationApplicationService {

    private final IConversationRepository conversationRepository;
    private final IQueryRepository queryRepository;
    private final IKnowledgeRetriever knowledgeRetriever;
    private final IReminderSink reminderSink;
    private final QueryTransitionDomainService queryTransitionDomainService;
    private final EscalationPolicyDomainService escalationPolicyDomainService;
    private final AnswerComposerDomainService answerComposerDomainService;
    private final CorrectionFeedbackDomainService correctionFeedbackDomainService;
    private final ReviewDeadlineApplicationService reviewDeadlineApplicationService;
    private final QueryDeliveryApplicationService queryDeliveryApplicationService;
    private final ReviewStateCommitService reviewStateCommitService;
    private final QueryLockRegistry queryLockRegistry;
    private final RetrievalOptions retrievalOptions;
    private final ExecutorService retrievalWorker;
    private final Clock clock;
    private final long retrievalTimeoutMs;
    private final long lockWaitMs;

    private final Counter submitCounter;
    private final Counter noAnswerCounter;
    private final Counter decisionCounter;
    private final Counter staleDecisionCounter;
    private final Counter escalateCounter;
    private final Counter expireCounter;
    private final Counter correctionCounter;
    private final Counter stalledRecoveredCounter;

    public QueryVerificationApplicationService(IConversationRepository conversationRepository,
                                               IQueryRepository queryRepository,
                                               IKnowledgeRetriever knowledgeRetriever,
                                               IReminderSink reminderSink,
                                               QueryTransitionDomainService queryTransitionDomainService,
                                               EscalationPolicyDomainService escalationPolicyDomainService,
                                               AnswerComposerDomainService answerComposerDomainService,
                                               CorrectionFeedbackDomainService correctionFeedbackDomainService,
                                               ReviewDeadlineApplicationService reviewDeadlineApplicationService,
                                               QueryDeliveryApplicationService queryDeliveryApplicationService,
                                               ReviewStateCommitService reviewStateCommitService,
                                               QueryLockRegistry queryLockRegistry,
                                               RetrievalOptions retrievalOptions,
                                               @Qualifier("retrievalWorker") ExecutorService retrievalWorker,
                                               Clock clock,
                                               @Value("${relay.retrieval.timeout-ms:5000}") long retrievalTimeoutMs,
                                               @Value("${relay.scheduler.lock-wait-ms:200}") long lockWaitMs) {
        this.conversationRepository = conversationRepository;
        this.queryRepository = queryRepository;
        this.knowledgeRetriever = knowledgeRetriever;
        this.reminderSink = reminderSink;
        this.queryTransitionDomainService = queryTransitionDomainService;
        this.escalationPolicyDomainService = escalationPolicyDomainService;
        this.answerComposerDomainService = answerComposerDomainService;
        this.correctionFeedbackDomainService = correctionFeedbackDomainService;
        this.reviewDeadlineApplicationService = reviewDeadlineApplicationService;
        this.queryDeliveryApplicationService = queryDeliveryApplicationService;
        this.reviewStateCommitService = reviewStateCommitService;
        this.queryLockRegistry = queryLockRegistry;
        this.retrievalOptions = retrievalOptions;
        this.retrievalWorker = retrievalWorker;
        this.clock = clock;
        this.retrievalTimeoutMs = retrievalTimeoutMs > 0 ? retrievalTimeoutMs : 5000L;
        this.lockWaitMs = Math.max(lockWaitMs, 0L);
        this.submitCounter = Counter.builder("relay.query.submit.total").register(Metrics.globalRegistry);
        this.noAnswerCounter = Counter.builder("relay.query.no_answer.total").register(Metrics.globalRegistry);
        this.decisionCounter = Counter.builder("relay.review.decision.total").register(Metrics.globalRegistry);
        this.staleDecisionCounter = Counter.builder("relay.review.decision.stale.total").register(Metrics.globalRegistry);
        this.escalateCounter = Counter.builder("relay.review.escalate.total").register(Metrics.globalRegistry);
        this.expireCounter = Counter.builder("relay.review.expire.total").register(Metrics.globalRegistry);
        this.correctionCounter = Counter.builder("relay.feedback.correction.total").register(Metrics.globalRegistry);
        this.stalledRecoveredCounter = Counter.builder("relay.query.stalled_recovered.total").register(Metrics.globalRegistry);
    }

    /**
     * 提交用户问题。
     * <p>
     * 检索或落库阶段失败时，在返回错误前尝试把 Query 关闭为 NO_ANSWER_AVAILABLE；
     * 这一步也失败时由调度器的滞留清理收尾。
     * </p>
     *
     * @throws AppException DUPLICATE_PENDING 会话已有未完成问题，info 为面向用户的等待提示
     */
    public QueryHandle submit(String channel, String userExternalId, String text, String locale) {
        String normalizedText = queryTransitionDomainService.normalizeText(text);
        if (StringUtils.isBlank(normalizedText)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Query text cannot be blank");
        }
        ConversationKey key;
        try {
            key = new ConversationKey(channel, userExternalId);
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, ex.getMessage());
        }
        String conversationId = key.conversationId();
        String normalizedLocale = StringUtils.trimToNull(locale);

        QueryEntity query = queryLockRegistry.withLock(QueryLockRegistry.conversationKey(conversationId),
                () -> openQuery(key, text, normalizedText, normalizedLocale));
        submitCounter.increment();
        log.info("REVIEW_EVENT action=received queryId={} conversationId={} locale={}",
                query.getId(), conversationId, query.getLocale());

        QueryEntity settled;
        try {
            settled = retrieveAndSettle(query);
        } catch (RuntimeException ex) {
            log.warn("REVIEW_EVENT action=settle_failed queryId={} conversationId={} error={}",
                    query.getId(), conversationId, ex.getMessage());
            settled = closeAfterSettleFailure(query.getId(), ex);
            if (settled == null) {
                throw ex;
            }
        }
        return new QueryHandle(settled.getId(), settled.getConversationId(), settled.getStatus());
    }

    /**
     * 记录专家审核动作。只在 PENDING_REVIEW 且（默认）由当前负责专家发起时生效。
     */
    public TransitionResult recordExpertDecision(Long queryId, String expertId, ExpertDecisionEnum decision, String text) {
        if (queryId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Query id cannot be null");
        }
        if (StringUtils.isBlank(expertId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Expert id cannot be blank");
        }
        if (decision == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Decision cannot be null");
        }
        if (decision == ExpertDecisionEnum.EDIT && StringUtils.isBlank(text)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "Edited text cannot be blank");
        }
        String normalizedExpertId = expertId.trim();

        return queryLockRegistry.withLock(QueryLockRegistry.queryKey(queryId), () -> {
            QueryEntity query = queryRepository.findById(queryId);
            if (query == null) {
                throw new AppException(ResponseCode.QUERY_NOT_FOUND, "Query not found: " + queryId);
            }
            DecisionCheck check = queryTransitionDomainService.checkDecision(query, normalizedExpertId,
                    escalationPolicyDomainService.policy().acceptSupersededDecisions());
            if (check != DecisionCheck.ACCEPT) {
                staleDecisionCounter.increment();
                log.info("REVIEW_EVENT action=stale_decision code={} queryId={} expertId={} decision={} reason={} status={} assignedExpertId={}",
                        ResponseCode.STALE_REVIEW_ACTION.getCode(),
                        queryId,
                        normalizedExpertId,
                        decision.getCode(),
                        check,
                        query.getStatus(),
                        query.getAssignedExpertId());
                return TransitionResult.stale(queryId, query);
            }

            LocalDateTime now = now();
            queryTransitionDomainService.applyDecision(query, normalizedExpertId, decision, text, now);
            CorrectionRecord record = correctionFeedbackDomainService.buildRecord(query, now);
            reviewStateCommitService.commitDecision(query, record);
            decisionCounter.increment();
            log.info("REVIEW_EVENT action=decided queryId={} conversationId={} expertId={} outcome={} level={}",
                    queryId,
                    query.getConversationId(),
                    normalizedExpertId,
                    query.getReviewOutcome(),
                    query.getEscalationLevel());

            if (record != null) {
                correctionCounter.increment();
                log.info("FEEDBACK_EVENT action=correction_recorded queryId={} correctionId={} outcome={}",
                        queryId, record.getId(), record.getOutcome());
            }

            queryDeliveryApplicationService.deliver(query);
            return TransitionResult.applied(query);
        });
    }

    /**
     * 升级到下一级专家（调度器专用）。
     */
    public TransitionResult escalate(Long queryId) {
        return queryLockRegistry.tryWithLock(QueryLockRegistry.queryKey(queryId), lockWaitMs, () -> {
            QueryEntity query = queryRepository.findById(queryId);
            int maxLevel = escalationPolicyDomainService.maxLevel();
            if (!queryTransitionDomainService.canEscalate(query, maxLevel)) {
                return staleSchedulerAction("escalate", queryId, query);
            }
            ReviewTaskEntity task = reviewDeadlineApplicationService.find(queryId);
            if (task == null) {
                log.warn("REVIEW_EVENT action=escalate_skipped reason=task_missing queryId={}", queryId);
                return TransitionResult.stale(queryId, query);
            }

            LocalDateTime now = now();
            if (!task.isDue(now)) {
                // 已被其它调度线程推进到下一窗口
                log.debug("REVIEW_EVENT action=escalate_stale reason=not_due queryId={} deadline={}", queryId, task.getDeadline());
                return TransitionResult.stale(queryId, query);
            }
            int nextLevel = query.normalizedEscalationLevel() + 1;
            String expertId = escalationPolicyDomainService.expertFor(nextLevel, queryId);
            String previousExpertId = query.getAssignedExpertId();
            query.escalateTo(nextLevel, expertId, now);
            ReviewTaskEntity advanced = reviewStateCommitService.commitEscalation(query, task, now);
            escalateCounter.increment();
            log.info("REVIEW_EVENT action=escalated queryId={} conversationId={} level={} fromExpertId={} toExpertId={} deadline={}",
                    queryId,
                    query.getConversationId(),
                    nextLevel,
                    previousExpertId,
                    expertId,
                    advanced.getDeadline());
            notifyExpert(expertId, notice(ReviewNoticeTypeEnum.ESCALATED, query, advanced, null));
            return TransitionResult.applied(query);
        }, () -> TransitionResult.skippedLocked(queryId));
    }

    /**
     * 最高级别仍超时：过期并告知用户仍在处理（调度器专用）。
     */
    public TransitionResult expire(Long queryId) {
        return queryLockRegistry.tryWithLock(QueryLockRegistry.queryKey(queryId), lockWaitMs, () -> {
            QueryEntity query = queryRepository.findById(queryId);
            if (!queryTransitionDomainService.canExpire(query, escalationPolicyDomainService.maxLevel())) {
                return staleSchedulerAction("expire", queryId, query);
            }
            LocalDateTime now = now();
            ReviewTaskEntity task = reviewDeadlineApplicationService.find(queryId);
            if (task != null && !task.isDue(now)) {
                log.debug("REVIEW_EVENT action=expire_stale reason=not_due queryId={} deadline={}", queryId, task.getDeadline());
                return TransitionResult.stale(queryId, query);
            }
            query.expire(now);
            reviewStateCommitService.commitExpiry(query);
            expireCounter.increment();
            log.info("REVIEW_EVENT action=expired queryId={} conversationId={} level={} expertId={}",
                    queryId, query.getConversationId(), query.getEscalationLevel(), query.getAssignedExpertId());
            queryDeliveryApplicationService.deliver(query);
            return TransitionResult.applied(query);
        }, () -> TransitionResult.skippedLocked(queryId));
    }

    /**
     * 重新投递之前失败或超时的消息。
     */
    public TransitionResult redeliver(Long queryId) {
        return queryLockRegistry.tryWithLock(QueryLockRegistry.queryKey(queryId), lockWaitMs, () -> {
            QueryEntity query = queryRepository.findById(queryId);
            if (query == null || !query.hasPendingDelivery()) {
                return TransitionResult.stale(queryId, query);
            }
            boolean delivered = queryDeliveryApplicationService.deliver(query);
            log.info("DELIVERY_EVENT action=redeliver queryId={} delivered={} attempts={}",
                    queryId, delivered, query.getDeliveryAttempts());
            return TransitionResult.applied(query);
        }, () -> TransitionResult.skippedLocked(queryId));
    }

    /**
     * 关闭在检索阶段滞留超过 {@link #stalledCutoff(LocalDateTime)} 的 Query（调度器专用）。
     */
    public TransitionResult recoverStalled(Long queryId) {
        return queryLockRegistry.tryWithLock(QueryLockRegistry.queryKey(queryId), lockWaitMs, () -> {
            QueryEntity query = queryRepository.findById(queryId);
            LocalDateTime now = now();
            if (query == null || !query.isRetrievalOpen()
                    || (query.getUpdatedAt() != null && !query.getUpdatedAt().isBefore(stalledCutoff(now)))) {
                return TransitionResult.stale(queryId, query);
            }
            closeWithoutAnswer(query, now, "stalled");
            stalledRecoveredCounter.increment();
            return TransitionResult.applied(query);
        }, () -> TransitionResult.skippedLocked(queryId));
    }

    /**
     * 检索阶段的滞留判定线：早于该时间仍未离开检索阶段的 Query 视为滞留。
     * 取两倍检索超时，为正在收尾的提交留出余量。
     */
    public LocalDateTime stalledCutoff(LocalDateTime now) {
        return now.minus(Duration.ofMillis(retrievalTimeoutMs * 2));
    }

    private QueryEntity openQuery(ConversationKey key, String rawText, String normalizedText, String locale) {
        LocalDateTime now = now();
        String conversationId = key.conversationId();
        ConversationEntity conversation = conversationRepository.findById(conversationId);
        if (conversation == null) {
            conversation = conversationRepository.save(ConversationEntity.open(key, locale, now));
            log.info("Conversation opened. conversationId={}, locale={}", conversationId, conversation.getLocale());
        } else {
            conversationRepository.recordInbound(conversationId, locale, now);
        }

        if (conversation.getPendingQueryId() != null) {
            QueryEntity current = queryRepository.findById(conversation.getPendingQueryId());
            if (queryTransitionDomainService.blocksNewSubmission(current)) {
                String waitingLocale = StringUtils.defaultIfBlank(locale, conversation.resolvedLocale());
                log.info("REVIEW_EVENT action=duplicate_pending code={} conversationId={} pendingQueryId={} status={}",
                        ResponseCode.DUPLICATE_PENDING.getCode(), conversationId, current.getId(), current.getStatus());
                throw new AppException(ResponseCode.DUPLICATE_PENDING, answerComposerDomainService.waitingText(waitingLocale));
            }
        }

        String queryLocale = StringUtils.defaultIfBlank(locale, conversation.resolvedLocale());
        QueryEntity query = QueryEntity.receive(conversationId, rawText, normalizedText, queryLocale, now);
        return reviewStateCommitService.commitOpened(query, now);
    }

    private QueryEntity retrieveAndSettle(QueryEntity query) {
        List<RetrievedCandidate> ranked;
        try {
            ranked = retrieve(query);
        } catch (AppException ex) {
            if (!ex.is(ResponseCode.RETRIEVAL_UNAVAILABLE) && !ex.is(ResponseCode.RETRIEVAL_TIMEOUT)) {
                throw ex;
            }
            log.warn("REVIEW_EVENT action=retrieval_failed queryId={} conversationId={} code={} error={}",
                    query.getId(), query.getConversationId(), ex.getCode(), ex.getInfo());
            ranked = Collections.emptyList();
        }
        List<RetrievedCandidate> candidates = ranked;
        return queryLockRegistry.withLock(QueryLockRegistry.queryKey(query.getId()),
                () -> settleRetrieval(query.getId(), candidates));
    }

    /**
     * 提交收尾失败后的补救：Query 仍在检索阶段时关闭为无答案。补救本身失败时返回 null，
     * 异常挂到原始异常上。
     */
    private QueryEntity closeAfterSettleFailure(Long queryId, RuntimeException cause) {
        try {
            return queryLockRegistry.withLock(QueryLockRegistry.queryKey(queryId), () -> {
                QueryEntity query = queryRepository.findById(queryId);
                if (query == null || !query.isRetrievalOpen()) {
                    return null;
                }
                closeWithoutAnswer(query, now(), "settle_failed");
                return query;
            });
        } catch (RuntimeException ex) {
            cause.addSuppressed(ex);
            log.error("REVIEW_EVENT action=settle_recovery_failed queryId={} error={}", queryId, ex.getMessage());
            return null;
        }
    }

    private void closeWithoutAnswer(QueryEntity query, LocalDateTime now, String reason) {
        query.rejectNoAnswer(now);
        reviewStateCommitService.commitClosedBeforeReview(query);
        noAnswerCounter.increment();
        log.info("REVIEW_EVENT action=no_answer queryId={} conversationId={} closeReason={} reason={}",
                query.getId(), query.getConversationId(), query.getCloseReason(), reason);
        queryDeliveryApplicationService.deliver(query);
    }

    private List<RetrievedCandidate> retrieve(QueryEntity query) {
        RetrievalOptions options = retrievalOptions.withLocale(query.getLocale());
        Future<List<RetrievedCandidate>> future;
        try {
            future = retrievalWorker.submit(() -> knowledgeRetriever.search(query.getNormalizedText(), options));
        } catch (RejectedExecutionException ex) {
            throw new AppException(ResponseCode.RETRIEVAL_UNAVAILABLE, "Retrieval worker rejected task", ex);
        }
        try {
            List<RetrievedCandidate> ranked = future.get(retrievalTimeoutMs, TimeUnit.MILLISECONDS);
            return ranked == null ? Collections.emptyList() : ranked;
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new AppException(ResponseCode.RETRIEVAL_TIMEOUT,
                    "Retrieval timed out after " + retrievalTimeoutMs + "ms", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AppException(ResponseCode.RETRIEVAL_UNAVAILABLE, "Retrieval interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof AppException appException && appException.is(ResponseCode.RETRIEVAL_UNAVAILABLE)) {
                throw appException;
            }
            throw new AppException(ResponseCode.RETRIEVAL_UNAVAILABLE, "Retrieval failed: " + cause.getMessage(), cause);
        }
    }

    private QueryEntity settleRetrieval(Long queryId, List<RetrievedCandidate> ranked) {
        QueryEntity query = queryRepository.findById(queryId);
        if (query == null) {
            throw new AppException(ResponseCode.QUERY_NOT_FOUND, "Query not found: " + queryId);
        }
        if (query.getStatus() != QueryStatusEnum.RETRIEVING) {
            // 检索期间已被滞留清理关闭
            log.info("REVIEW_EVENT action=settle_stale queryId={} status={}", queryId, query.getStatus());
            return query;
        }
        LocalDateTime now = now();
        if (ranked.isEmpty()) {
            closeWithoutAnswer(query, now, "no_candidates");
            return query;
        }

        DraftAnswer draft = answerComposerDomainService.composeDraft(query.getNormalizedText(), ranked);
        String expertId = escalationPolicyDomainService.expertFor(0, query.getId());
        query.awaitReview(ranked, draft, expertId, now);
        ReviewTaskEntity task = reviewStateCommitService.commitReviewRequest(query, expertId, now);
        log.info("REVIEW_EVENT action=review_requested queryId={} conversationId={} expertId={} candidates={} deadline={}",
                query.getId(), query.getConversationId(), expertId, ranked.size(), task.getDeadline());
        notifyExpert(expertId, notice(ReviewNoticeTypeEnum.REVIEW_REQUEST, query, task, null));
        return query;
    }

    /**
     * 专家通知在状态提交之后发送，发送失败不回滚已提交的迁移，由提醒档位兜底。
     */
    private void notifyExpert(String expertId, ReviewNotice notice) {
        try {
            reminderSink.notify(expertId, notice);
        } catch (RuntimeException ex) {
            log.warn("REVIEW_EVENT action=notify_failed queryId={} expertId={} type={} error={}",
                    notice.getQueryId(), expertId, notice.getType(), ex.getMessage());
        }
    }

    private TransitionResult staleSchedulerAction(String action, Long queryId, QueryEntity query) {
        if (query == null || !query.isPendingReview()) {
            // 审核已结束但任务仍在：清理遗留任务
            if (reviewDeadlineApplicationService.cancel(queryId)) {
                log.warn("REVIEW_EVENT action=orphan_task_removed trigger={} queryId={} status={}",
                        action, queryId, query == null ? null : query.getStatus());
            }
        }
        log.debug("REVIEW_EVENT action={}_stale code={} queryId={} status={} level={}",
                action,
                ResponseCode.STALE_REVIEW_ACTION.getCode(),
                queryId,
                query == null ? null : query.getStatus(),
                query == null ? null : query.getEscalationLevel());
        return TransitionResult.stale(queryId, query);
    }

    static ReviewNotice notice(ReviewNoticeTypeEnum type, QueryEntity query, ReviewTaskEntity task, Integer tierPercent) {
        return ReviewNotice.builder()
                .type(type)
                .queryId(query.getId())
                .conversationId(query.getConversationId())
                .escalationLevel(task.getEscalationLevel())
                .reminderTierPercent(tierPercent)
                .deadline(task.getDeadline())
                .reviewPacket(query.getReviewPacket())
                .build();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
