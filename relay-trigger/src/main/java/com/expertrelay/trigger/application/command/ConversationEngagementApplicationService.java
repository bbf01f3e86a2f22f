package com.expertrelay.trigger.application.command;

import com.expertrelay.domain.conversation.adapter.repository.IConversationRepository;
import com.expertrelay.domain.conversation.adapter.repository.IQueryRepository;
import com.expertrelay.domain.conversation.model.entity.ConversationEntity;
import com.expertrelay.domain.conversation.model.entity.QueryEntity;
import com.expertrelay.domain.conversation.service.QueryTransitionDomainService;
import com.expertrelay.domain.delivery.model.valobj.DeliveryContent;
import com.expertrelay.domain.delivery.model.valobj.DeliveryDecision;
import com.expertrelay.domain.knowledge.service.AnswerComposerDomainService;
import com.expertrelay.trigger.application.common.QueryLockRegistry;
import com.expertrelay.types.enums.ContentCategoryEnum;
import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 会话活跃度维护：空闲用户提醒与长期不活跃会话过期。
 * <p>
 * 有未完成问题的会话不提醒也不过期。
 * </p>
 */
@Slf4j
@Service
public class ConversationEngagementApplicationService {

    private final IConversationRepository conversationRepository;
    private final IQueryRepository queryRepository;
    private final QueryTransitionDomainService queryTransitionDomainService;
    private final AnswerComposerDomainService answerComposerDomainService;
    private final QueryDeliveryApplicationService queryDeliveryApplicationService;
    private final QueryLockRegistry queryLockRegistry;
    private final Duration userReminderAfter;
    private final Duration conversationExpiryAfter;
    private final int batchSize;
    private final long lockWaitMs;

    private final Counter userReminderCounter;
    private final Counter conversationExpiredCounter;

    public ConversationEngagementApplicationService(IConversationRepository conversationRepository,
                                                    IQueryRepository queryRepository,
                                                    QueryTransitionDomainService queryTransitionDomainService,
                                                    AnswerComposerDomainService answerComposerDomainService,
                                                    QueryDeliveryApplicationService queryDeliveryApplicationService,
                                                    QueryLockRegistry queryLockRegistry,
                                                    @Value("${relay.engagement.user-reminder-after:20h}") Duration userReminderAfter,
                                                    @Value("${relay.engagement.conversation-expiry-after:7d}") Duration conversationExpiryAfter,
                                                    @Value("${relay.scheduler.batch-size:200}") int batchSize,
                                                    @Value("${relay.scheduler.lock-wait-ms:200}") long lockWaitMs) {
        this.conversationRepository = conversationRepository;
        this.queryRepository = queryRepository;
        this.queryTransitionDomainService = queryTransitionDomainService;
        this.answerComposerDomainService = answerComposerDomainService;
        this.queryDeliveryApplicationService = queryDeliveryApplicationService;
        this.queryLockRegistry = queryLockRegistry;
        this.userReminderAfter = userReminderAfter;
        this.conversationExpiryAfter = conversationExpiryAfter;
        this.batchSize = batchSize > 0 ? batchSize : 200;
        this.lockWaitMs = Math.max(lockWaitMs, 0L);
        this.userReminderCounter = Counter.builder("relay.engagement.user_reminder.total").register(Metrics.globalRegistry);
        this.conversationExpiredCounter = Counter.builder("relay.engagement.conversation_expired.total").register(Metrics.globalRegistry);
    }

    public EngagementResult remindIdle(LocalDateTime now) {
        List<ConversationEntity> idle = conversationRepository.findActiveIdleBefore(now.minus(userReminderAfter), batchSize);
        int reminded = 0;
        int errors = 0;
        for (ConversationEntity candidate : idle) {
            if (candidate.isRemindedSinceLastInbound()) {
                continue;
            }
            try {
                Boolean sent = queryLockRegistry.tryWithLock(QueryLockRegistry.conversationKey(candidate.getId()), lockWaitMs,
                        () -> remindOne(candidate.getId(), now),
                        () -> Boolean.FALSE);
                if (Boolean.TRUE.equals(sent)) {
                    reminded++;
                }
            } catch (AppException ex) {
                if (ex.is(ResponseCode.STORE_UNAVAILABLE)) {
                    throw ex;
                }
                errors++;
                log.warn("ENGAGEMENT_EVENT action=user_reminder_failed conversationId={} code={} error={}",
                        candidate.getId(), ex.getCode(), ex.getInfo());
            } catch (RuntimeException ex) {
                errors++;
                log.warn("ENGAGEMENT_EVENT action=user_reminder_failed conversationId={} error={}",
                        candidate.getId(), ex.getMessage());
            }
        }
        return new EngagementResult(reminded, errors);
    }

    public EngagementResult expireStale(LocalDateTime now) {
        List<ConversationEntity> stale = conversationRepository.findActiveIdleBefore(now.minus(conversationExpiryAfter), batchSize);
        int expired = 0;
        int errors = 0;
        for (ConversationEntity candidate : stale) {
            try {
                Boolean marked = queryLockRegistry.tryWithLock(QueryLockRegistry.conversationKey(candidate.getId()), lockWaitMs,
                        () -> expireOne(candidate.getId(), now),
                        () -> Boolean.FALSE);
                if (Boolean.TRUE.equals(marked)) {
                    expired++;
                }
            } catch (AppException ex) {
                if (ex.is(ResponseCode.STORE_UNAVAILABLE)) {
                    throw ex;
                }
                errors++;
                log.warn("ENGAGEMENT_EVENT action=expire_failed conversationId={} code={} error={}",
                        candidate.getId(), ex.getCode(), ex.getInfo());
            } catch (RuntimeException ex) {
                errors++;
                log.warn("ENGAGEMENT_EVENT action=expire_failed conversationId={} error={}",
                        candidate.getId(), ex.getMessage());
            }
        }
        return new EngagementResult(expired, errors);
    }

    private Boolean remindOne(String conversationId, LocalDateTime now) {
        ConversationEntity conversation = conversationRepository.findById(conversationId);
        if (conversation == null
                || !conversation.isActive()
                || !conversation.isIdleSince(now.minus(userReminderAfter))
                || conversation.isRemindedSinceLastInbound()
                || hasOpenQuery(conversation)) {
            return Boolean.FALSE;
        }
        DeliveryContent content = answerComposerDomainService.composeDelivery(conversation, null, ContentCategoryEnum.USER_REMINDER);
        DeliveryDecision decision = queryDeliveryApplicationService.send(conversation, content);
        conversationRepository.markUserReminded(conversationId, now);
        conversationRepository.recordOutbound(conversationId, now);
        userReminderCounter.increment();
        log.info("ENGAGEMENT_EVENT action=user_reminded conversationId={} mode={} template={} lastInboundAt={}",
                conversationId, decision.mode(), decision.payload().getTemplateName(), conversation.getLastInboundAt());
        return Boolean.TRUE;
    }

    private Boolean expireOne(String conversationId, LocalDateTime now) {
        ConversationEntity conversation = conversationRepository.findById(conversationId);
        if (conversation == null
                || !conversation.isActive()
                || !conversation.isIdleSince(now.minus(conversationExpiryAfter))
                || hasOpenQuery(conversation)) {
            return Boolean.FALSE;
        }
        boolean marked = conversationRepository.markExpired(conversationId, now);
        if (marked) {
            conversationExpiredCounter.increment();
            log.info("ENGAGEMENT_EVENT action=conversation_expired conversationId={} lastInboundAt={}",
                    conversationId, conversation.getLastInboundAt());
        }
        return marked;
    }

    private boolean hasOpenQuery(ConversationEntity conversation) {
        if (conversation.getPendingQueryId() == null) {
            return false;
        }
        QueryEntity current = queryRepository.findById(conversation.getPendingQueryId());
        return queryTransitionDomainService.blocksNewSubmission(current);
    }

    public record EngagementResult(int count, int errorCount) {
    }
}
