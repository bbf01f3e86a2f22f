package com.expertrelay.infrastructure.repository.review;

import com.expertrelay.domain.review.adapter.repository.IReviewTaskRepository;
import com.expertrelay.domain.review.model.entity.ReviewTaskEntity;
import com.expertrelay.infrastructure.dao.ReviewTaskDao;
import com.expertrelay.infrastructure.dao.po.ReviewTaskPO;
import com.expertrelay.infrastructure.repository.support.StoreAccess;
import com.expertrelay.infrastructure.util.JsonCodec;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 审核任务仓储实现类。deadline 与 next_reminder_at 两列上的索引即调度器的时间序索引。
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Repository
public class ReviewTaskRepositoryImpl implements IReviewTaskRepository {

    private final ReviewTaskDao reviewTaskDao;
    private final JsonCodec jsonCodec;

    public ReviewTaskRepositoryImpl(ReviewTaskDao reviewTaskDao, JsonCodec jsonCodec) {
        this.reviewTaskDao = reviewTaskDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public ReviewTaskEntity save(ReviewTaskEntity entity) {
        entity.validate();
        ReviewTaskPO po = toPO(entity);
        StoreAccess.call("reviewTask.insert", () -> reviewTaskDao.insert(po));
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public ReviewTaskEntity update(ReviewTaskEntity entity) {
        entity.validate();
        StoreAccess.call("reviewTask.update", () -> reviewTaskDao.update(toPO(entity)));
        return entity;
    }

    @Override
    public ReviewTaskEntity findByQueryId(Long queryId) {
        ReviewTaskPO po = StoreAccess.call("reviewTask.select", () -> reviewTaskDao.selectByQueryId(queryId));
        return po != null ? toEntity(po) : null;
    }

    @Override
    public boolean deleteByQueryId(Long queryId) {
        return StoreAccess.call("reviewTask.delete", () -> reviewTaskDao.deleteByQueryId(queryId)) > 0;
    }

    @Override
    public List<ReviewTaskEntity> findDueBefore(LocalDateTime now, int limit) {
        return StoreAccess.call("reviewTask.selectDue", () -> reviewTaskDao.selectDueBefore(now, limit))
                .stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<ReviewTaskEntity> findReminderDueBefore(LocalDateTime now, int limit) {
        return StoreAccess.call("reviewTask.selectReminderDue", () -> reviewTaskDao.selectReminderDueBefore(now, limit))
                .stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private ReviewTaskEntity toEntity(ReviewTaskPO po) {
        ReviewTaskEntity entity = new ReviewTaskEntity();
        entity.setId(po.getId());
        entity.setQueryId(po.getQueryId());
        entity.setConversationId(po.getConversationId());
        entity.setAssignedExpertId(po.getAssignedExpertId());
        entity.setEscalationLevel(po.getEscalationLevel());
        entity.setWindowStartedAt(po.getWindowStartedAt());
        entity.setDeadline(po.getDeadline());
        Set<Integer> tiers = jsonCodec.readIntegerSet(po.getSentReminderTiers());
        entity.setSentReminderTiers(tiers == null ? new TreeSet<>() : new TreeSet<>(tiers));
        entity.setNextReminderAt(po.getNextReminderAt());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private ReviewTaskPO toPO(ReviewTaskEntity entity) {
        return ReviewTaskPO.builder()
                .id(entity.getId())
                .queryId(entity.getQueryId())
                .conversationId(entity.getConversationId())
                .assignedExpertId(entity.getAssignedExpertId())
                .escalationLevel(entity.getEscalationLevel())
                .windowStartedAt(entity.getWindowStartedAt())
                .deadline(entity.getDeadline())
                .sentReminderTiers(jsonCodec.writeValue(entity.getSentReminderTiers() == null
                        ? new TreeSet<Integer>() : entity.getSentReminderTiers()))
                .nextReminderAt(entity.getNextReminderAt())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
