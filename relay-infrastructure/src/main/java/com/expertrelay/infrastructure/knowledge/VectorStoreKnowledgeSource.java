package com.expertrelay.infrastructure.knowledge;

import com.expertrelay.domain.knowledge.model.valobj.RetrievalOptions;
import com.expertrelay.domain.knowledge.model.valobj.RetrievedCandidate;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 基于 Spring AI VectorStore 的知识源。
 */
public class VectorStoreKnowledgeSource implements KnowledgeSource {

    private static final String SOURCE_ID_KEY = "source_id";

    private final String name;
    private final VectorStore vectorStore;
    private final double weight;

    public VectorStoreKnowledgeSource(String name, VectorStore vectorStore, double weight) {
        this.name = name;
        this.vectorStore = vectorStore;
        this.weight = weight;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double weight() {
        return weight;
    }

    @Override
    public List<RetrievedCandidate> search(String text, RetrievalOptions options) {
        SearchRequest request = SearchRequest.builder()
                .query(text)
                .topK(options.topK())
                .similarityThreshold(options.minScore())
                .build();
        List<Document> documents = vectorStore.similaritySearch(request);
        if (documents == null || documents.isEmpty()) {
            return Collections.emptyList();
        }
        return documents.stream()
                .filter(document -> StringUtils.isNotBlank(document.getText()))
                .map(this::toCandidate)
                .collect(Collectors.toList());
    }

    private RetrievedCandidate toCandidate(Document document) {
        Map<String, Object> metadata = document.getMetadata();
        Object sourceId = metadata == null ? null : metadata.get(SOURCE_ID_KEY);
        return RetrievedCandidate.builder()
                .content(document.getText())
                .sourceId(name + ":" + (sourceId == null ? document.getId() : String.valueOf(sourceId)))
                .score(document.getScore())
                .build();
    }
}
