package com.expertrelay.domain.knowledge.model.valobj;

/**
 * 草稿答案与发给专家的审核包。
 *
 * @param chosen       被选中的候选
 * @param text         草稿答案正文
 * @param reviewPacket 审核包文本
 */
public record DraftAnswer(RetrievedCandidate chosen, String text, String reviewPacket) {
}
