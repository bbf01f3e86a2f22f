package com.expertrelay.infrastructure.repository.conversation;

import com.expertrelay.domain.conversation.adapter.repository.IConversationRepository;
import com.expertrelay.domain.conversation.model.entity.ConversationEntity;
import com.expertrelay.infrastructure.dao.ConversationDao;
import com.expertrelay.infrastructure.dao.po.ConversationPO;
import com.expertrelay.infrastructure.repository.support.StoreAccess;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 会话仓储实现类。
 * <p>
 * 创建使用 insert ... on conflict do nothing，其余写操作均为按列定向更新。
 * </p>
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Slf4j
@Repository
public class ConversationRepositoryImpl implements IConversationRepository {

    private final ConversationDao conversationDao;

    public ConversationRepositoryImpl(ConversationDao conversationDao) {
        this.conversationDao = conversationDao;
    }

    @Override
    public ConversationEntity save(ConversationEntity entity) {
        entity.validate();
        ConversationPO po = toPO(entity);
        int affected = StoreAccess.call("conversation.insert", () -> conversationDao.insert(po));
        if (affected == 0) {
            log.debug("Conversation already exists, reuse stored row. conversationId={}", entity.getId());
            return findById(entity.getId());
        }
        return toEntity(po);
    }

    @Override
    public ConversationEntity findById(String id) {
        ConversationPO po = StoreAccess.call("conversation.select", () -> conversationDao.selectById(id));
        return po != null ? toEntity(po) : null;
    }

    @Override
    public boolean recordInbound(String id, String locale, LocalDateTime inboundAt) {
        return StoreAccess.call("conversation.inbound", () -> conversationDao.updateInbound(id, locale, inboundAt)) > 0;
    }

    @Override
    public boolean recordOutbound(String id, LocalDateTime outboundAt) {
        return StoreAccess.call("conversation.outbound", () -> conversationDao.updateOutbound(id, outboundAt)) > 0;
    }

    @Override
    public boolean bindPendingQuery(String id, Long queryId, String expertId, int escalationLevel, LocalDateTime now) {
        return StoreAccess.call("conversation.bindQuery",
                () -> conversationDao.updatePendingQuery(id, queryId, expertId, escalationLevel, now)) > 0;
    }

    @Override
    public boolean updateReviewAssignment(String id, String expertId, int escalationLevel, LocalDateTime now) {
        return StoreAccess.call("conversation.assignment",
                () -> conversationDao.updateReviewAssignment(id, expertId, escalationLevel, now)) > 0;
    }

    @Override
    public boolean markUserReminded(String id, LocalDateTime remindedAt) {
        return StoreAccess.call("conversation.reminded", () -> conversationDao.updateUserReminded(id, remindedAt)) > 0;
    }

    @Override
    public boolean markExpired(String id, LocalDateTime expiredAt) {
        return StoreAccess.call("conversation.expire", () -> conversationDao.updateExpired(id, expiredAt)) > 0;
    }

    @Override
    public List<ConversationEntity> findActiveIdleBefore(LocalDateTime before, int limit) {
        return StoreAccess.call("conversation.selectIdle", () -> conversationDao.selectActiveIdleBefore(before, limit))
                .stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private ConversationEntity toEntity(ConversationPO po) {
        if (po == null) {
            return null;
        }
        ConversationEntity entity = new ConversationEntity();
        entity.setId(po.getId());
        entity.setChannel(po.getChannel());
        entity.setUserExternalId(po.getUserExternalId());
        entity.setStatus(po.getStatus());
        entity.setLocale(po.getLocale());
        entity.setLastInboundAt(po.getLastInboundAt());
        entity.setLastOutboundAt(po.getLastOutboundAt());
        entity.setPendingQueryId(po.getPendingQueryId());
        entity.setAssignedExpertId(po.getAssignedExpertId());
        entity.setEscalationLevel(po.getEscalationLevel());
        entity.setLastUserReminderAt(po.getLastUserReminderAt());
        entity.setExpiredAt(po.getExpiredAt());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private ConversationPO toPO(ConversationEntity entity) {
        return ConversationPO.builder()
                .id(entity.getId())
                .channel(entity.getChannel())
                .userExternalId(entity.getUserExternalId())
                .status(entity.getStatus())
                .locale(entity.getLocale())
                .lastInboundAt(entity.getLastInboundAt())
                .lastOutboundAt(entity.getLastOutboundAt())
                .pendingQueryId(entity.getPendingQueryId())
                .assignedExpertId(entity.getAssignedExpertId())
                .escalationLevel(entity.getEscalationLevel())
                .lastUserReminderAt(entity.getLastUserReminderAt())
                .expiredAt(entity.getExpiredAt())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
