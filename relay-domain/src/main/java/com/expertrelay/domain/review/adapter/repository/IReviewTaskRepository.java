package com.expertrelay.domain.review.adapter.repository;

import com.expertrelay.domain.review.model.entity.ReviewTaskEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 审核任务仓储接口
 *
 * @author expertrelay
 * @since 2026-03-02
 */
public interface IReviewTaskRepository {

    /**
     * 保存审核任务
     */
    ReviewTaskEntity save(ReviewTaskEntity entity);

    /**
     * 更新审核任务
     */
    ReviewTaskEntity update(ReviewTaskEntity entity);

    /**
     * 根据 Query ID 查询
     */
    ReviewTaskEntity findByQueryId(Long queryId);

    /**
     * 根据 Query ID 删除
     */
    boolean deleteByQueryId(Long queryId);

    /**
     * 查询截止时间不晚于 now 的任务，按截止时间升序
     */
    List<ReviewTaskEntity> findDueBefore(LocalDateTime now, int limit);

    /**
     * 查询提醒时间不晚于 now 且尚未到期的任务，按提醒时间升序
     */
    List<ReviewTaskEntity> findReminderDueBefore(LocalDateTime now, int limit);
}
