package com.expertrelay.infrastructure.dao;

import com.expertrelay.infrastructure.dao.po.QueryPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 问题 DAO
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Mapper
public interface QueryDao {

    /**
     * 插入 Query，回填主键
     */
    int insert(QueryPO po);

    /**
     * 根据 ID 更新 (带乐观锁，po.version 为新版本号)
     */
    int updateWithVersion(QueryPO po);

    /**
     * 根据 ID 查询
     */
    QueryPO selectById(@Param("id") Long id);

    /**
     * 查询待投递 Query
     */
    List<QueryPO> selectPendingDelivery(@Param("limit") Integer limit);

    /**
     * 查询检索阶段滞留的 Query
     */
    List<QueryPO> selectStalledBefore(@Param("cutoff") LocalDateTime cutoff,
                                      @Param("limit") Integer limit);
}
