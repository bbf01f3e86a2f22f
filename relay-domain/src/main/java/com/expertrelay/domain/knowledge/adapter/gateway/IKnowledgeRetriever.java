package com.expertrelay.domain.knowledge.adapter.gateway;

import com.expertrelay.domain.knowledge.model.valobj.RetrievalOptions;
import com.expertrelay.domain.knowledge.model.valobj.RetrievedCandidate;

import java.util.List;

/**
 * 知识检索网关。
 */
public interface IKnowledgeRetriever {

    /**
     * 检索候选，按相关度降序返回；可能为空列表。
     *
     * @throws com.expertrelay.types.exception.AppException RETRIEVAL_UNAVAILABLE 知识库不可用时
     */
    List<RetrievedCandidate> search(String text, RetrievalOptions options);
}
