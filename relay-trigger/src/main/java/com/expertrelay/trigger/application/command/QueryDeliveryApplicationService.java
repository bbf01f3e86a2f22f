package com.expertrelay.trigger.application.command;

import com.expertrelay.domain.conversation.adapter.repository.IConversationRepository;
import com.expertrelay.domain.conversation.adapter.repository.IQueryRepository;
import com.expertrelay.domain.conversation.model.entity.ConversationEntity;
import com.expertrelay.domain.conversation.model.entity.QueryEntity;
import com.expertrelay.domain.delivery.adapter.gateway.IChannelAdapter;
import com.expertrelay.domain.delivery.model.valobj.DeliveryContent;
import com.expertrelay.domain.delivery.model.valobj.DeliveryDecision;
import com.expertrelay.domain.delivery.service.DeliverySelectorDomainService;
import com.expertrelay.domain.knowledge.service.AnswerComposerDomainService;
import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 下发用例：查询窗口状态、选择下发方式、在投递线程池上限时发送并记录结果。
 * <p>
 * 调用方须持有对应 Query 的迁移锁，保证同一条消息不会被并发发送两次。
 * 投递失败或超时不改变 Query 状态，只保留 PENDING 投递标记，由调度器重新投递。
 * </p>
 */
@Slf4j
@Service
public class QueryDeliveryApplicationService {

    private final IConversationRepository conversationRepository;
    private final IQueryRepository queryRepository;
    private final IChannelAdapter channelAdapter;
    private final DeliverySelectorDomainService deliverySelectorDomainService;
    private final AnswerComposerDomainService answerComposerDomainService;
    private final ExecutorService deliveryWorker;
    private final Clock clock;
    private final long deliveryTimeoutMs;

    private final Counter sentCounter;
    private final Counter genericFallbackCounter;
    private final Counter failureCounter;

    public QueryDeliveryApplicationService(IConversationRepository conversationRepository,
                                           IQueryRepository queryRepository,
                                           IChannelAdapter channelAdapter,
                                           DeliverySelectorDomainService deliverySelectorDomainService,
                                           AnswerComposerDomainService answerComposerDomainService,
                                           @Qualifier("deliveryWorker") ExecutorService deliveryWorker,
                                           Clock clock,
                                           @Value("${relay.delivery.timeout-ms:5000}") long deliveryTimeoutMs) {
        this.conversationRepository = conversationRepository;
        this.queryRepository = queryRepository;
        this.channelAdapter = channelAdapter;
        this.deliverySelectorDomainService = deliverySelectorDomainService;
        this.answerComposerDomainService = answerComposerDomainService;
        this.deliveryWorker = deliveryWorker;
        this.clock = clock;
        this.deliveryTimeoutMs = deliveryTimeoutMs > 0 ? deliveryTimeoutMs : 5000L;
        this.sentCounter = Counter.builder("relay.delivery.sent.total").register(Metrics.globalRegistry);
        this.genericFallbackCounter = Counter.builder("relay.delivery.generic_fallback.total").register(Metrics.globalRegistry);
        this.failureCounter = Counter.builder("relay.delivery.failure.total").register(Metrics.globalRegistry);
    }

    /**
     * 投递 Query 待发送的消息。
     *
     * @return 是否发送成功
     */
    public boolean deliver(QueryEntity query) {
        if (query == null || !query.hasPendingDelivery()) {
            return false;
        }
        ConversationEntity conversation = conversationRepository.findById(query.getConversationId());
        if (conversation == null) {
            throw new AppException(ResponseCode.UN_ERROR,
                    "Conversation missing for query: " + query.getId());
        }
        DeliveryContent content = answerComposerDomainService.composeDelivery(conversation, query, query.getPendingCategory());
        DeliveryDecision decision;
        try {
            decision = send(conversation, content);
        } catch (AppException ex) {
            if (!ex.is(ResponseCode.DELIVERY_FAILED) && !ex.is(ResponseCode.DELIVERY_TIMEOUT)) {
                throw ex;
            }
            query.recordDeliveryFailure(ex.getCode() + ":" + ex.getInfo(), LocalDateTime.now(clock));
            queryRepository.update(query);
            log.warn("DELIVERY_EVENT action=failed queryId={} conversationId={} category={} attempts={} code={} error={}",
                    query.getId(),
                    query.getConversationId(),
                    query.getPendingCategory(),
                    query.getDeliveryAttempts(),
                    ex.getCode(),
                    ex.getInfo());
            return false;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        query.markDelivered(decision.mode(), decision.payload().getTemplateName(), now);
        queryRepository.update(query);
        conversationRepository.recordOutbound(conversation.getId(), now);
        log.info("DELIVERY_EVENT action=sent queryId={} conversationId={} category={} mode={} template={} status={} attempts={}",
                query.getId(),
                query.getConversationId(),
                query.getPendingCategory(),
                decision.mode(),
                decision.payload().getTemplateName(),
                query.getStatus(),
                query.getDeliveryAttempts());
        return true;
    }

    /**
     * 发送一条不关联 Query 的消息（如空闲提醒）。
     *
     * @throws AppException DELIVERY_FAILED / DELIVERY_TIMEOUT
     */
    public DeliveryDecision send(ConversationEntity conversation, DeliveryContent content) {
        boolean windowOpen = resolveWindow(conversation);
        DeliveryDecision decision = deliverySelectorDomainService.select(conversation, content, windowOpen);
        Future<?> future;
        try {
            future = deliveryWorker.submit(() -> channelAdapter.send(conversation, decision.payload()));
        } catch (RejectedExecutionException ex) {
            failureCounter.increment();
            throw new AppException(ResponseCode.DELIVERY_FAILED, "Delivery worker rejected task", ex);
        }
        try {
            future.get(deliveryTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            failureCounter.increment();
            throw new AppException(ResponseCode.DELIVERY_TIMEOUT,
                    "Delivery timed out after " + deliveryTimeoutMs + "ms", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            failureCounter.increment();
            throw new AppException(ResponseCode.DELIVERY_FAILED, "Delivery interrupted", ex);
        } catch (ExecutionException ex) {
            failureCounter.increment();
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof AppException appException) {
                throw appException;
            }
            throw new AppException(ResponseCode.DELIVERY_FAILED, "Delivery failed: " + cause.getMessage(), cause);
        }
        sentCounter.increment();
        if (decision.payload().isGenericFallback()) {
            genericFallbackCounter.increment();
        }
        return decision;
    }

    private boolean resolveWindow(ConversationEntity conversation) {
        try {
            return channelAdapter.isFreeFormWindowOpen(conversation);
        } catch (RuntimeException ex) {
            log.warn("Free-form window check failed, treat as closed. conversationId={}, error={}",
                    conversation.getId(), ex.getMessage());
            return false;
        }
    }
}
