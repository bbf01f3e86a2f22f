package com.expertrelay.domain.knowledge.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 知识库检索候选：内容、来源标识与相关度分数。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RetrievedCandidate {

    /** 候选内容 */
    private String content;

    /** 来源标识（文档 ID / 知识源名称） */
    private String sourceId;

    /** 相关度分数，越大越相关 */
    private Double score;

    public double scoreOrZero() {
        return score == null ? 0D : score;
    }
}
