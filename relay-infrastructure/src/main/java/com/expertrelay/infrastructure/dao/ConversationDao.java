package com.expertrelay.infrastructure.dao;

import com.expertrelay.infrastructure.dao.po.ConversationPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 会话 DAO
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Mapper
public interface ConversationDao {

    /**
     * 插入会话（主键冲突时忽略）
     */
    int insert(ConversationPO po);

    /**
     * 根据 ID 查询
     */
    ConversationPO selectById(@Param("id") String id);

    /**
     * 刷新最近收信时间并重新激活
     */
    int updateInbound(@Param("id") String id,
                      @Param("locale") String locale,
                      @Param("inboundAt") LocalDateTime inboundAt);

    /**
     * 刷新最近发信时间
     */
    int updateOutbound(@Param("id") String id,
                       @Param("outboundAt") LocalDateTime outboundAt);

    /**
     * 绑定当前 Query
     */
    int updatePendingQuery(@Param("id") String id,
                           @Param("queryId") Long queryId,
                           @Param("expertId") String expertId,
                           @Param("escalationLevel") Integer escalationLevel,
                           @Param("now") LocalDateTime now);

    /**
     * 更新审核分配
     */
    int updateReviewAssignment(@Param("id") String id,
                               @Param("expertId") String expertId,
                               @Param("escalationLevel") Integer escalationLevel,
                               @Param("now") LocalDateTime now);

    /**
     * 记录空闲提醒时间
     */
    int updateUserReminded(@Param("id") String id,
                           @Param("remindedAt") LocalDateTime remindedAt);

    /**
     * 标记过期（仅 ACTIVE）
     */
    int updateExpired(@Param("id") String id,
                      @Param("expiredAt") LocalDateTime expiredAt);

    /**
     * 查询空闲的活跃会话
     */
    List<ConversationPO> selectActiveIdleBefore(@Param("before") LocalDateTime before,
                                                @Param("limit") Integer limit);
}
