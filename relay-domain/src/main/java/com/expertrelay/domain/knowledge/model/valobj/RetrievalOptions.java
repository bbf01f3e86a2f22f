package com.expertrelay.domain.knowledge.model.valobj;

/**
 * 检索参数。
 *
 * @param topK     返回候选上限
 * @param minScore 最低相关度
 * @param locale   问题语言
 */
public record RetrievalOptions(int topK, double minScore, String locale) {

    public RetrievalOptions {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
    }

    public RetrievalOptions withLocale(String value) {
        return new RetrievalOptions(topK, minScore, value);
    }
}
