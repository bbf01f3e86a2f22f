package com.expertrelay.infrastructure.dao;

import com.expertrelay.infrastructure.dao.po.ReviewTaskPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 审核任务 DAO
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Mapper
public interface ReviewTaskDao {

    int insert(ReviewTaskPO po);

    int update(ReviewTaskPO po);

    ReviewTaskPO selectByQueryId(@Param("queryId") Long queryId);

    int deleteByQueryId(@Param("queryId") Long queryId);

    /**
     * 查询到期任务，按截止时间升序
     */
    List<ReviewTaskPO> selectDueBefore(@Param("now") LocalDateTime now,
                                       @Param("limit") Integer limit);

    /**
     * 查询提醒已到点且未到期的任务，按提醒时间升序
     */
    List<ReviewTaskPO> selectReminderDueBefore(@Param("now") LocalDateTime now,
                                               @Param("limit") Integer limit);
}
