package com.expertrelay.domain.conversation.adapter.repository;

import com.expertrelay.domain.conversation.model.entity.ConversationEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 会话仓储接口
 * <p>
 * 除创建外只提供按列的定向更新，避免与 Query 行锁形成整行覆盖竞争。
 * </p>
 *
 * @author expertrelay
 * @since 2026-03-02
 */
public interface IConversationRepository {

    /**
     * 创建会话
     */
    ConversationEntity save(ConversationEntity entity);

    /**
     * 根据 ID 查询
     */
    ConversationEntity findById(String id);

    /**
     * 记录用户消息：刷新最近收信时间与语言，过期会话重新激活
     */
    boolean recordInbound(String id, String locale, LocalDateTime inboundAt);

    /**
     * 记录下发消息时间
     */
    boolean recordOutbound(String id, LocalDateTime outboundAt);

    /**
     * 绑定当前 Query 及审核分配
     */
    boolean bindPendingQuery(String id, Long queryId, String expertId, int escalationLevel, LocalDateTime now);

    /**
     * 更新审核分配（升级时调用）
     */
    boolean updateReviewAssignment(String id, String expertId, int escalationLevel, LocalDateTime now);

    /**
     * 记录空闲提醒时间
     */
    boolean markUserReminded(String id, LocalDateTime remindedAt);

    /**
     * 标记过期（仅 ACTIVE 会话生效）
     */
    boolean markExpired(String id, LocalDateTime expiredAt);

    /**
     * 查询最近收信早于 before 的活跃会话，按最近收信时间升序
     */
    List<ConversationEntity> findActiveIdleBefore(LocalDateTime before, int limit);
}
