package com.expertrelay.test.support;

import com.expertrelay.domain.conversation.adapter.repository.IConversationRepository;
import com.expertrelay.domain.conversation.model.entity.ConversationEntity;
import com.expertrelay.types.enums.ConversationStatusEnum;
import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.exception.AppException;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 内存会话仓储。
 */
public class InMemoryConversationRepository implements IConversationRepository {

    private final Map<String, ConversationEntity> store = new LinkedHashMap<>();
    private volatile boolean unavailable;

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    @Override
    public synchronized ConversationEntity save(ConversationEntity entity) {
        checkAvailable();
        entity.validate();
        ConversationEntity existing = store.get(entity.getId());
        if (existing != null) {
            return existing;
        }
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public synchronized ConversationEntity findById(String id) {
        checkAvailable();
        return store.get(id);
    }

    @Override
    public synchronized boolean recordInbound(String id, String locale, LocalDateTime inboundAt) {
        ConversationEntity entity = require(id);
        if (entity == null) {
            return false;
        }
        entity.setLastInboundAt(inboundAt);
        if (locale != null) {
            entity.setLocale(locale);
        }
        entity.setStatus(ConversationStatusEnum.ACTIVE);
        entity.setExpiredAt(null);
        entity.setUpdatedAt(inboundAt);
        return true;
    }

    @Override
    public synchronized boolean recordOutbound(String id, LocalDateTime outboundAt) {
        ConversationEntity entity = require(id);
        if (entity == null) {
            return false;
        }
        entity.setLastOutboundAt(outboundAt);
        entity.setUpdatedAt(outboundAt);
        return true;
    }

    @Override
    public synchronized boolean bindPendingQuery(String id, Long queryId, String expertId, int escalationLevel, LocalDateTime now) {
        ConversationEntity entity = require(id);
        if (entity == null) {
            return false;
        }
        entity.setPendingQueryId(queryId);
        entity.setAssignedExpertId(expertId);
        entity.setEscalationLevel(escalationLevel);
        entity.setUpdatedAt(now);
        return true;
    }

    @Override
    public synchronized boolean updateReviewAssignment(String id, String expertId, int escalationLevel, LocalDateTime now) {
        ConversationEntity entity = require(id);
        if (entity == null) {
            return false;
        }
        entity.setAssignedExpertId(expertId);
        entity.setEscalationLevel(escalationLevel);
        entity.setUpdatedAt(now);
        return true;
    }

    @Override
    public synchronized boolean markUserReminded(String id, LocalDateTime remindedAt) {
        ConversationEntity entity = require(id);
        if (entity == null) {
            return false;
        }
        entity.setLastUserReminderAt(remindedAt);
        return true;
    }

    @Override
    public synchronized boolean markExpired(String id, LocalDateTime expiredAt) {
        ConversationEntity entity = require(id);
        if (entity == null || entity.getStatus() != ConversationStatusEnum.ACTIVE) {
            return false;
        }
        entity.setStatus(ConversationStatusEnum.EXPIRED);
        entity.setExpiredAt(expiredAt);
        return true;
    }

    @Override
    public synchronized List<ConversationEntity> findActiveIdleBefore(LocalDateTime before, int limit) {
        checkAvailable();
        return store.values().stream()
                .filter(ConversationEntity::isActive)
                .filter(entity -> entity.isIdleSince(before))
                .sorted(Comparator.comparing(entity -> entity.getLastInboundAt() == null
                        ? entity.getCreatedAt() : entity.getLastInboundAt()))
                .limit(limit)
                .collect(Collectors.toList());
    }

    private ConversationEntity require(String id) {
        checkAvailable();
        return store.get(id);
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new AppException(ResponseCode.STORE_UNAVAILABLE, "conversation store down");
        }
    }
}
