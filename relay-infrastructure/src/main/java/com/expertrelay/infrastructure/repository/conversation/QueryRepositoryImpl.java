package com.expertrelay.infrastructure.repository.conversation;

import com.expertrelay.domain.conversation.adapter.repository.IQueryRepository;
import com.expertrelay.domain.conversation.model.entity.QueryEntity;
import com.expertrelay.domain.knowledge.model.valobj.RetrievedCandidate;
import com.expertrelay.infrastructure.dao.QueryDao;
import com.expertrelay.infrastructure.dao.po.QueryPO;
import com.expertrelay.infrastructure.repository.support.StoreAccess;
import com.expertrelay.infrastructure.util.JsonCodec;
import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 问题仓储实现类。
 * <p>
 * 候选列表与选中候选以 JSONB 存储；更新带乐观锁，版本冲突抛出 STORE_CONFLICT。
 * </p>
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Slf4j
@Repository
public class QueryRepositoryImpl implements IQueryRepository {

    private final QueryDao queryDao;
    private final JsonCodec jsonCodec;

    public QueryRepositoryImpl(QueryDao queryDao, JsonCodec jsonCodec) {
        this.queryDao = queryDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public QueryEntity save(QueryEntity entity) {
        entity.validate();
        QueryPO po = toPO(entity);
        StoreAccess.call("query.insert", () -> queryDao.insert(po));
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public QueryEntity update(QueryEntity entity) {
        entity.validate();
        int expectedVersion = entity.normalizedVersion();
        entity.incrementVersion();
        QueryPO po = toPO(entity);
        int affected = StoreAccess.call("query.update", () -> queryDao.updateWithVersion(po));
        if (affected == 0) {
            entity.setVersion(expectedVersion);
            throw new AppException(ResponseCode.STORE_CONFLICT,
                    "Optimistic lock failed for Query: " + entity.getId());
        }
        return entity;
    }

    @Override
    public QueryEntity findById(Long id) {
        QueryPO po = StoreAccess.call("query.select", () -> queryDao.selectById(id));
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<QueryEntity> findPendingDelivery(int limit) {
        return StoreAccess.call("query.selectPendingDelivery", () -> queryDao.selectPendingDelivery(limit))
                .stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<QueryEntity> findStalledBefore(LocalDateTime cutoff, int limit) {
        return StoreAccess.call("query.selectStalled", () -> queryDao.selectStalledBefore(cutoff, limit))
                .stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private QueryEntity toEntity(QueryPO po) {
        QueryEntity entity = new QueryEntity();
        entity.setId(po.getId());
        entity.setConversationId(po.getConversationId());
        entity.setRawText(po.getRawText());
        entity.setNormalizedText(po.getNormalizedText());
        entity.setLocale(po.getLocale());
        entity.setStatus(po.getStatus());

        List<RetrievedCandidate> candidates = jsonCodec.readCandidates(po.getCandidates());
        entity.setCandidates(candidates == null ? Collections.emptyList() : Collections.unmodifiableList(candidates));
        entity.setChosenCandidate(jsonCodec.readCandidate(po.getChosenCandidate()));

        entity.setDraftAnswer(po.getDraftAnswer());
        entity.setReviewPacket(po.getReviewPacket());
        entity.setFinalAnswer(po.getFinalAnswer());
        entity.setReviewOutcome(po.getReviewOutcome());
        entity.setExpertNote(po.getExpertNote());
        entity.setActedByExpertId(po.getActedByExpertId());
        entity.setActedAt(po.getActedAt());
        entity.setEscalationLevel(po.getEscalationLevel());
        entity.setAssignedExpertId(po.getAssignedExpertId());
        entity.setCloseReason(po.getCloseReason());
        entity.setDeliveryState(po.getDeliveryState());
        entity.setPendingCategory(po.getPendingCategory());
        entity.setDeliveryMode(po.getDeliveryMode());
        entity.setDeliveryTemplate(po.getDeliveryTemplate());
        entity.setDeliveryAttempts(po.getDeliveryAttempts());
        entity.setLastDeliveryError(po.getLastDeliveryError());
        entity.setDeliveredAt(po.getDeliveredAt());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        entity.setVersion(po.getVersion());
        return entity;
    }

    private QueryPO toPO(QueryEntity entity) {
        QueryPO po = QueryPO.builder()
                .id(entity.getId())
                .conversationId(entity.getConversationId())
                .rawText(entity.getRawText())
                .normalizedText(entity.getNormalizedText())
                .locale(entity.getLocale())
                .status(entity.getStatus())
                .draftAnswer(entity.getDraftAnswer())
                .reviewPacket(entity.getReviewPacket())
                .finalAnswer(entity.getFinalAnswer())
                .reviewOutcome(entity.getReviewOutcome())
                .expertNote(entity.getExpertNote())
                .actedByExpertId(entity.getActedByExpertId())
                .actedAt(entity.getActedAt())
                .escalationLevel(entity.getEscalationLevel())
                .assignedExpertId(entity.getAssignedExpertId())
                .closeReason(entity.getCloseReason())
                .deliveryState(entity.getDeliveryState())
                .pendingCategory(entity.getPendingCategory())
                .deliveryMode(entity.getDeliveryMode())
                .deliveryTemplate(entity.getDeliveryTemplate())
                .deliveryAttempts(entity.getDeliveryAttempts())
                .lastDeliveryError(entity.getLastDeliveryError())
                .deliveredAt(entity.getDeliveredAt())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .version(entity.getVersion())
                .build();

        if (entity.getCandidates() != null) {
            po.setCandidates(jsonCodec.writeValue(entity.getCandidates()));
        }
        if (entity.getChosenCandidate() != null) {
            po.setChosenCandidate(jsonCodec.writeValue(entity.getChosenCandidate()));
        }
        return po;
    }
}
