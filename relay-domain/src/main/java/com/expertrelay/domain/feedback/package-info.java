/**
 * Feedback 领域 - 专家纠错账本
 *
 * <p>专家修改或拒绝草稿时追加一条不可变纠错记录；账本是知识库离线吸收流程唯一可见的接口。</p>
 */
package com.expertrelay.domain.feedback;
