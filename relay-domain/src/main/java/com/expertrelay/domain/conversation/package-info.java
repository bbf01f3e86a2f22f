/**
 * Conversation 领域 - 会话与问题生命周期
 *
 * <p>职责：维护用户会话（渠道 + 用户外部标识）与单个问题（Query）的审核状态机。</p>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.expertrelay.domain.conversation.model.entity.ConversationEntity}</li>
 *   <li>{@link com.expertrelay.domain.conversation.model.entity.QueryEntity}</li>
 * </ul>
 *
 * <h3>不变量</h3>
 * <ul>
 *   <li>每个会话同一时刻最多一个非终态 Query</li>
 *   <li>审核结果单向迁移：PENDING → APPROVED / EDITED / REJECTED</li>
 * </ul>
 *
 * @author expertrelay
 * @since 2026-03-02
 */
package com.expertrelay.domain.conversation;
