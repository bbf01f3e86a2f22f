package com.expertrelay.infrastructure.knowledge;

import com.expertrelay.domain.knowledge.adapter.gateway.IKnowledgeRetriever;
import com.expertrelay.domain.knowledge.model.valobj.RetrievalOptions;
import com.expertrelay.domain.knowledge.model.valobj.RetrievedCandidate;
import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * 多知识源并行检索。
 * <p>
 * 各源结果按权重调整分数后合并、按内容去重（保留最高分）、过滤最低分并取 topK。
 * 只要有一个源成功即返回结果（可能为空列表）；全部失败或未配置任何源时抛出 RETRIEVAL_UNAVAILABLE。
 * </p>
 */
@Slf4j
public class FanOutKnowledgeRetriever implements IKnowledgeRetriever {

    private final List<KnowledgeSource> sources;
    private final ExecutorService executor;
    private final long sourceTimeoutMs;
    private final Counter sourceFailureCounter;

    public FanOutKnowledgeRetriever(List<KnowledgeSource> sources, ExecutorService executor, long sourceTimeoutMs) {
        this.sources = sources == null ? List.of() : List.copyOf(sources);
        this.executor = executor;
        this.sourceTimeoutMs = Math.max(sourceTimeoutMs, 1L);
        this.sourceFailureCounter = Counter.builder("relay.retrieval.source.failure.total")
                .register(Metrics.globalRegistry);
    }

    public List<String> sourceNames() {
        return sources.stream().map(KnowledgeSource::name).collect(Collectors.toList());
    }

    @Override
    public List<RetrievedCandidate> search(String text, RetrievalOptions options) {
        if (sources.isEmpty()) {
            throw new AppException(ResponseCode.RETRIEVAL_UNAVAILABLE, "No knowledge source configured");
        }
        Map<KnowledgeSource, Future<List<RetrievedCandidate>>> futures = new LinkedHashMap<>();
        for (KnowledgeSource source : sources) {
            try {
                futures.put(source, executor.submit(() -> source.search(text, options)));
            } catch (RejectedExecutionException ex) {
                log.warn("Knowledge source rejected by worker pool. source={}, error={}", source.name(), ex.getMessage());
            }
        }

        List<RetrievedCandidate> merged = new ArrayList<>();
        int succeeded = 0;
        for (Map.Entry<KnowledgeSource, Future<List<RetrievedCandidate>>> entry : futures.entrySet()) {
            KnowledgeSource source = entry.getKey();
            Future<List<RetrievedCandidate>> future = entry.getValue();
            try {
                List<RetrievedCandidate> found = future.get(sourceTimeoutMs, TimeUnit.MILLISECONDS);
                succeeded++;
                if (found != null) {
                    found.forEach(candidate -> merged.add(weighted(candidate, source.weight())));
                }
            } catch (TimeoutException ex) {
                future.cancel(true);
                sourceFailureCounter.increment();
                log.warn("Knowledge source timed out. source={}, timeoutMs={}", source.name(), sourceTimeoutMs);
            } catch (InterruptedException ex) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new AppException(ResponseCode.RETRIEVAL_UNAVAILABLE, "Knowledge retrieval interrupted", ex);
            } catch (ExecutionException ex) {
                sourceFailureCounter.increment();
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                log.warn("Knowledge source failed. source={}, error={}", source.name(), cause.getMessage());
            }
        }
        if (succeeded == 0) {
            throw new AppException(ResponseCode.RETRIEVAL_UNAVAILABLE,
                    "All knowledge sources failed, sources=" + sources.size());
        }
        return rank(merged, options);
    }

    private List<RetrievedCandidate> rank(List<RetrievedCandidate> merged, RetrievalOptions options) {
        Map<String, RetrievedCandidate> deduplicated = new LinkedHashMap<>();
        for (RetrievedCandidate candidate : merged) {
            if (StringUtils.isBlank(candidate.getContent())) {
                continue;
            }
            String key = StringUtils.normalizeSpace(candidate.getContent()).toLowerCase(Locale.ROOT);
            RetrievedCandidate existing = deduplicated.get(key);
            if (existing == null || candidate.scoreOrZero() > existing.scoreOrZero()) {
                deduplicated.put(key, candidate);
            }
        }
        return deduplicated.values().stream()
                .filter(candidate -> candidate.scoreOrZero() >= options.minScore())
                .sorted(Comparator.comparingDouble(RetrievedCandidate::scoreOrZero).reversed()
                        .thenComparing(candidate -> StringUtils.defaultString(candidate.getSourceId())))
                .limit(options.topK())
                .collect(Collectors.toList());
    }

    private RetrievedCandidate weighted(RetrievedCandidate candidate, double weight) {
        return candidate.toBuilder()
                .score(candidate.scoreOrZero() * weight)
                .build();
    }
}
