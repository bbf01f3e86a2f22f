package com.expertrelay.domain.conversation.adapter.repository;

import com.expertrelay.domain.conversation.model.entity.QueryEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 问题仓储接口
 *
 * @author expertrelay
 * @since 2026-03-02
 */
public interface IQueryRepository {

    /**
     * 保存 Query，回填主键
     */
    QueryEntity save(QueryEntity entity);

    /**
     * 更新 Query (带乐观锁，冲突时抛出 STORE_CONFLICT)
     */
    QueryEntity update(QueryEntity entity);

    /**
     * 根据 ID 查询
     */
    QueryEntity findById(Long id);

    /**
     * 查询待投递的 Query，按更新时间升序
     */
    List<QueryEntity> findPendingDelivery(int limit);

    /**
     * 查询停留在 RECEIVED / RETRIEVING 且更新时间早于 cutoff 的 Query，按更新时间升序
     */
    List<QueryEntity> findStalledBefore(LocalDateTime cutoff, int limit);
}
