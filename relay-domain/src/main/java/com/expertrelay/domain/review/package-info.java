/**
 * Review 领域 - 专家审核任务与升级策略
 *
 * <p>职责：管理每个待审核 Query 的审核任务（截止时间、升级级别、已发送提醒），
 * 并按策略计算升级窗口、专家分配与提醒档位。</p>
 *
 * <h3>不变量</h3>
 * <ul>
 *   <li>每个 PENDING_REVIEW 的 Query 恰有一个审核任务，Query 关闭时删除</li>
 *   <li>升级级别与截止时间严格单调递增</li>
 *   <li>同一升级窗口内每个提醒档位最多发送一次</li>
 * </ul>
 */
package com.expertrelay.domain.review;
