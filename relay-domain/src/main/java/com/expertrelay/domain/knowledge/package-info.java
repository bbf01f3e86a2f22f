/**
 * Knowledge 领域 - 知识检索与答案组装
 *
 * <p>检索只读访问知识库；编排核心从不写入知识库，专家修正通过 feedback 领域的纠错账本对外暴露。</p>
 */
package com.expertrelay.domain.knowledge;
