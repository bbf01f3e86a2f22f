package com.expertrelay.test.infrastructure;

import com.expertrelay.domain.knowledge.model.valobj.RetrievalOptions;
import com.expertrelay.domain.knowledge.model.valobj.RetrievedCandidate;
import com.expertrelay.infrastructure.knowledge.FanOutKnowledgeRetriever;
import com.expertrelay.infrastructure.knowledge.KnowledgeSource;
import com.expertrelay.infrastructure.knowledge.VectorStoreKnowledgeSource;
import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.exception.AppException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class FanOutKnowledgeRetrieverTest {

    private static final RetrievalOptions OPTIONS = new RetrievalOptions(3, 0.3D, "en");

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void shouldMergeWeightDeduplicateAndRank() {
        KnowledgeSource faq = new StubSource("faq", 1.0D, () -> List.of(
                candidate("Reset it from settings.", "faq:1", 0.8D),
                candidate("Contact support.", "faq:2", 0.5D),
                candidate("Irrelevant.", "faq:3", 0.1D)));
        KnowledgeSource manual = new StubSource("manual", 0.5D, () -> List.of(
                candidate("reset it   from settings.", "manual:9", 0.9D),
                candidate("Use the mobile app.", "manual:4", 0.8D)));
        FanOutKnowledgeRetriever retriever = new FanOutKnowledgeRetriever(List.of(faq, manual), executor, 1000L);

        List<RetrievedCandidate> ranked = retriever.search("reset", OPTIONS);

        Assertions.assertEquals(List.of("faq:1", "faq:2", "manual:4"),
                ranked.stream().map(RetrievedCandidate::getSourceId).collect(Collectors.toList()));
        Assertions.assertEquals(0.4D, ranked.get(2).getScore(), 1e-9);
        Assertions.assertEquals(List.of("faq", "manual"), retriever.sourceNames());
    }

    @Test
    public void shouldIgnoreFailedAndSlowSources() {
        KnowledgeSource broken = new StubSource("broken", 1.0D, () -> {
            throw new IllegalStateException("index offline");
        });
        KnowledgeSource slow = new StubSource("slow", 1.0D, () -> {
            try {
                Thread.sleep(2000L);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return List.of(candidate("Late answer.", "slow:1", 0.99D));
        });
        KnowledgeSource healthy = new StubSource("faq", 1.0D, () -> List.of(candidate("Reset it.", "faq:1", 0.7D)));
        FanOutKnowledgeRetriever retriever = new FanOutKnowledgeRetriever(List.of(broken, slow, healthy), executor, 100L);

        List<RetrievedCandidate> ranked = retriever.search("reset", OPTIONS);

        Assertions.assertEquals(1, ranked.size());
        Assertions.assertEquals("faq:1", ranked.get(0).getSourceId());
    }

    @Test
    public void shouldReturnEmptyWhenSourcesAnswerWithoutMatches() {
        FanOutKnowledgeRetriever retriever = new FanOutKnowledgeRetriever(
                List.of(new StubSource("faq", 1.0D, List::of)), executor, 1000L);

        Assertions.assertTrue(retriever.search("reset", OPTIONS).isEmpty());
    }

    @Test
    public void shouldFailWhenAllSourcesFail() {
        FanOutKnowledgeRetriever none = new FanOutKnowledgeRetriever(List.of(), executor, 1000L);
        FanOutKnowledgeRetriever broken = new FanOutKnowledgeRetriever(List.of(new StubSource("faq", 1.0D, () -> {
            throw new IllegalStateException("index offline");
        })), executor, 1000L);

        AppException noSource = Assertions.assertThrows(AppException.class, () -> none.search("reset", OPTIONS));
        AppException allFailed = Assertions.assertThrows(AppException.class, () -> broken.search("reset", OPTIONS));

        Assertions.assertEquals(ResponseCode.RETRIEVAL_UNAVAILABLE.getCode(), noSource.getCode());
        Assertions.assertEquals(ResponseCode.RETRIEVAL_UNAVAILABLE.getCode(), allFailed.getCode());
    }

    @Test
    public void shouldMapVectorStoreDocuments() {
        VectorStore vectorStore = mock(VectorStore.class);
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(
                Document.builder().id("doc-1").text("Reset it from settings.").metadata(Map.of("source_id", "kb-17")).score(0.82D).build(),
                Document.builder().id("doc-2").text("Use the app.").score(0.6D).build()));
        VectorStoreKnowledgeSource source = new VectorStoreKnowledgeSource("faq", vectorStore, 1.0D);

        List<RetrievedCandidate> candidates = source.search("reset", OPTIONS);

        Assertions.assertEquals(2, candidates.size());
        Assertions.assertEquals("faq:kb-17", candidates.get(0).getSourceId());
        Assertions.assertEquals(0.82D, candidates.get(0).getScore(), 1e-9);
        Assertions.assertEquals("faq:doc-2", candidates.get(1).getSourceId());
    }

    private static RetrievedCandidate candidate(String content, String sourceId, double score) {
        return RetrievedCandidate.builder().content(content).sourceId(sourceId).score(score).build();
    }

    private static class StubSource implements KnowledgeSource {

        private final String name;
        private final double weight;
        private final Supplier<List<RetrievedCandidate>> results;

        private StubSource(String name, double weight, Supplier<List<RetrievedCandidate>> results) {
            this.name = name;
            this.weight = weight;
            this.results = results;
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
            return results.get();
        }
    }
}
