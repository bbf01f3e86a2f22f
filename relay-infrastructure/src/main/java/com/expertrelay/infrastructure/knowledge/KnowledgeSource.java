package com.expertrelay.infrastructure.knowledge;

import com.expertrelay.domain.knowledge.model.valobj.RetrievalOptions;
import com.expertrelay.domain.knowledge.model.valobj.RetrievedCandidate;

import java.util.List;

/**
 * 单个知识源。由 {@link FanOutKnowledgeRetriever} 并行调用。
 */
public interface KnowledgeSource {

    String name();

    /**
     * 分数权重，作用于该源返回的相关度。
     */
    double weight();

    List<RetrievedCandidate> search(String text, RetrievalOptions options);
}
