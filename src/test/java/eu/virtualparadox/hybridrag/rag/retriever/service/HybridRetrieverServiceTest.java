package eu.virtualparadox.hybridrag.rag.retriever.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.hybridrag.application.config.RetrievalProperties;
import eu.virtualparadox.hybridrag.exception.EmbeddingProviderException;
import eu.virtualparadox.hybridrag.rag.embed.EmbeddingService;
import eu.virtualparadox.hybridrag.rag.index.LuceneVectorIndexService;
import eu.virtualparadox.hybridrag.rag.index.model.IndexSnapshot;
import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;
import eu.virtualparadox.hybridrag.rag.index.store.LuceneIndexStore;
import eu.virtualparadox.hybridrag.rag.keyword.KeywordExtractor;
import eu.virtualparadox.hybridrag.rag.keyword.KeywordIndexService;
import eu.virtualparadox.hybridrag.rag.retriever.model.RetrievalMode;
import eu.virtualparadox.hybridrag.rag.retriever.model.RetrievalOutcome;
import eu.virtualparadox.hybridrag.rag.retriever.model.SearchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HybridRetrieverServiceTest {

    private static final float[] QUERY_VECTOR = {0f, 1f};

    @Mock
    private EmbeddingService embeddingService;

    private LuceneVectorIndexService vectorIndexService;
    private KeywordIndexService keywordIndexService;
    private RetrievalProperties props;
    private HybridRetrieverService retriever;

    @BeforeEach
    void setUp() {
        vectorIndexService = new LuceneVectorIndexService(new LuceneIndexStore(new ObjectMapper()));
        keywordIndexService = new KeywordIndexService(new KeywordExtractor());
        props = new RetrievalProperties();
        retriever = new HybridRetrieverService(embeddingService, vectorIndexService, keywordIndexService, props);

        vectorIndexService.create(
                List.of(new float[]{1f, 0f},
                        new float[]{0f, 1f},
                        new float[]{0.1f, 0.9f},
                        new float[]{0.7f, 0.7f},
                        new float[]{-1f, 0f}),
                List.of(chunk("E-2 visa requires a treaty nationality."),
                        chunk("The application fee is $500."),
                        chunk("The application fee is $500!"),
                        chunk("L-1 visa covers intracompany transfers."),
                        chunk("Office hours are nine to five.")));
    }

    private static RetrievalUnit chunk(String text) {
        return RetrievalUnit.documentChunk(text, "guide.pdf", 1);
    }

    private static SearchResult result(long id, String text, double combined) {
        return new SearchResult(chunk(text).withId(id), 0.0, 0.0, combined, 0);
    }

    private static List<Long> ids(List<SearchResult> results) {
        return results.stream().map(r -> r.unit().id()).toList();
    }

    @Test
    @DisplayName("alpha = 1 reproduces the pure vector ranking")
    void alphaOneIsVectorRanking() {
        when(embeddingService.embedQuery(anyString())).thenReturn(QUERY_VECTOR);
        IndexSnapshot snapshot = vectorIndexService.snapshot();

        RetrievalOutcome outcome = retriever.hybridSearch("visa fee", 3, 1.0);

        List<Long> vectorRanking = snapshot.search(QUERY_VECTOR, 3).stream().map(h -> h.unit().id()).toList();
        assertEquals(vectorRanking, ids(outcome.results()));
        assertEquals(RetrievalMode.HYBRID, outcome.mode());
    }

    @Test
    @DisplayName("alpha = 0 reproduces the pure keyword ranking")
    void alphaZeroIsKeywordRanking() {
        when(embeddingService.embedQuery(anyString())).thenReturn(QUERY_VECTOR);
        IndexSnapshot snapshot = vectorIndexService.snapshot();

        RetrievalOutcome outcome = retriever.hybridSearch("visa fee", 3, 0.0);

        List<Long> keywordRanking = keywordIndexService.score(snapshot, "visa fee", 3).stream()
                .map(h -> h.unit().id()).toList();
        assertEquals(keywordRanking, ids(outcome.results()));
        assertEquals(List.of(0L, 3L, 1L), ids(outcome.results()));
    }

    @Test
    @DisplayName("Scores are fused linearly and ranks start at 1")
    void fusedScores() {
        when(embeddingService.embedQuery(anyString())).thenReturn(QUERY_VECTOR);

        RetrievalOutcome outcome = retriever.hybridSearch("visa fee", 5, 0.3);

        assertThat(outcome.results()).extracting(SearchResult::rank).containsExactly(1, 2, 3, 4, 5);
        SearchResult top = outcome.results().get(0);
        assertEquals(1L, top.unit().id());
        assertEquals(1.0, top.vectorScore(), 1e-6);
        assertEquals(0.3, top.keywordScore(), 1e-9);
        assertEquals(0.3 * 1.0 + 0.7 * 0.3, top.combinedScore(), 1e-6);
        for (int i = 1; i < outcome.results().size(); i++) {
            assertThat(outcome.results().get(i).combinedScore())
                    .isLessThanOrEqualTo(outcome.results().get(i - 1).combinedScore());
        }
    }

    @Test
    @DisplayName("Provider failure degrades to keyword-only results instead of failing")
    void providerFailureDegrades() {
        when(embeddingService.embedQuery(anyString())).thenThrow(new EmbeddingProviderException("model offline"));

        RetrievalOutcome outcome = retriever.hybridSearch("visa fee", 3, 0.7);

        assertEquals(RetrievalMode.KEYWORD_ONLY, outcome.mode());
        assertTrue(outcome.isDegraded());
        assertEquals("model offline", outcome.degradationReason());
        assertEquals(List.of(0L, 3L, 1L), ids(outcome.results()));
        assertThat(outcome.results()).allSatisfy(r -> {
            assertEquals(0.0, r.vectorScore());
            assertEquals(r.keywordScore(), r.combinedScore(), 1e-12);
        });
    }

    @Test
    @DisplayName("An undeclared runtime failure of the provider also degrades")
    void unexpectedProviderFailureDegrades() {
        when(embeddingService.embedQuery(anyString())).thenThrow(new IllegalStateException("Failed to embed batch"));

        RetrievalOutcome outcome = retriever.hybridSearch("visa fee", 3, 0.3);

        assertEquals(RetrievalMode.KEYWORD_ONLY, outcome.mode());
        assertEquals("Failed to embed batch", outcome.degradationReason());
        assertEquals(List.of(0L, 3L, 1L), ids(outcome.results()));
    }

    @Test
    @DisplayName("A query vector of another dimension than the index degrades instead of failing")
    void dimensionMismatchDegrades() {
        when(embeddingService.embedQuery(anyString())).thenReturn(new float[]{0f, 1f, 0f});

        RetrievalOutcome outcome = retriever.hybridSearch("visa fee", 3, 0.3);

        assertEquals(RetrievalMode.KEYWORD_ONLY, outcome.mode());
        assertThat(outcome.degradationReason()).contains("dimension 3");
        assertEquals(List.of(0L, 3L, 1L), ids(outcome.results()));
    }

    @Test
    @DisplayName("A failure without a message is still reported as degraded")
    void failureWithoutMessageDegrades() {
        when(embeddingService.embedQuery(anyString())).thenThrow(new EmbeddingProviderException(null));

        RetrievalOutcome outcome = retriever.hybridSearch("visa fee", 3, 0.3);

        assertEquals(RetrievalMode.KEYWORD_ONLY, outcome.mode());
        assertTrue(outcome.isDegraded());
        assertEquals("EmbeddingProviderException", outcome.degradationReason());
    }

    @Test
    @DisplayName("No evidence is an empty outcome, not an error")
    void noEvidence() {
        when(embeddingService.embedQuery(anyString())).thenReturn(QUERY_VECTOR);

        RetrievalOutcome outcome = retriever.hybridSearch("passport renewal", 5, 0.0);

        assertTrue(outcome.isEmpty());
        assertEquals(RetrievalMode.HYBRID, outcome.mode());
    }

    @Test
    @DisplayName("Blank query or empty index returns empty without embedding")
    void blankQueryAndEmptyIndex() {
        assertTrue(retriever.hybridSearch("  ", 5, 0.3).isEmpty());

        vectorIndexService.create(List.of(), List.of());
        assertTrue(retriever.hybridSearch("visa", 5, 0.3).isEmpty());

        verifyNoInteractions(embeddingService);
    }

    @Test
    @DisplayName("Invalid k or alpha is rejected")
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> retriever.hybridSearch("visa", 0, 0.5));
        assertThrows(IllegalArgumentException.class, () -> retriever.hybridSearch("visa", 3, 1.5));
        assertThrows(IllegalArgumentException.class, () -> retriever.hybridSearch("visa", 3, -0.1));
        assertThrows(IllegalArgumentException.class, () -> retriever.filterAndDeduplicate(List.of(), 0));
    }

    @Test
    @DisplayName("Results differing only in punctuation collapse to one")
    void punctuationVariantsCollapse() {
        List<SearchResult> filtered = retriever.filterAndDeduplicate(List.of(
                result(1, "The fee is $500.", 0.8),
                result(2, "The fee is $500!", 0.9)), 5);

        assertEquals(1, filtered.size());
        assertEquals(2L, filtered.get(0).unit().id());
        assertEquals(1, filtered.get(0).rank());
    }

    @Test
    @DisplayName("No two kept results reach the Jaccard threshold")
    void keptResultsAreDistinct() {
        List<SearchResult> filtered = retriever.filterAndDeduplicate(List.of(
                result(1, "abcdefghij", 0.9),
                result(2, "abcdefghik", 0.8),
                result(3, "ABCDEFGHIJ ", 0.7),
                result(4, "completely different words", 0.6),
                result(5, "xyz", 0.5)), 10);

        assertEquals(List.of(1L, 2L, 4L, 5L), ids(filtered));
        for (int i = 0; i < filtered.size(); i++) {
            for (int j = i + 1; j < filtered.size(); j++) {
                double similarity = HybridRetrieverService.jaccard(
                        HybridRetrieverService.charSet(HybridRetrieverService.normalize(filtered.get(i).text())),
                        HybridRetrieverService.charSet(HybridRetrieverService.normalize(filtered.get(j).text())));
                assertThat(similarity).isLessThan(0.9);
            }
        }
    }

    @Test
    @DisplayName("finalK bounds the kept results")
    void finalKBound() {
        List<SearchResult> filtered = retriever.filterAndDeduplicate(List.of(
                result(1, "first passage", 0.3),
                result(2, "zzz", 0.9),
                result(3, "qqq yyy", 0.5)), 2);

        assertEquals(List.of(2L, 3L), ids(filtered));
        assertThat(filtered).extracting(SearchResult::rank).containsExactly(1, 2);
    }

    @Test
    @DisplayName("retrieve applies the configured candidates, weighting and query-time dedup")
    void retrieveEndToEnd() {
        when(embeddingService.embedQuery(anyString())).thenReturn(QUERY_VECTOR);
        props.setTopKCandidates(3);
        props.setFinalK(2);
        props.setHybridAlpha(0.3);

        RetrievalOutcome outcome = retriever.retrieve("visa fee");

        // unit 2 only differs from unit 1 by its final punctuation
        assertEquals(List.of(1L, 3L), ids(outcome.results()));
        assertThat(outcome.results()).extracting(SearchResult::rank).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Units with identical text are joined by id, not by text")
    void identicalTextsStayDistinct() {
        when(embeddingService.embedQuery(anyString())).thenReturn(QUERY_VECTOR);
        vectorIndexService.create(
                List.of(new float[]{0f, 1f}, new float[]{1f, 0f}),
                List.of(chunk("visa information"), chunk("visa information")));

        RetrievalOutcome outcome = retriever.hybridSearch("visa", 5, 0.5);

        assertEquals(List.of(0L, 1L), ids(outcome.results()));
        assertEquals(1.0, outcome.results().get(0).vectorScore(), 1e-6);
        assertEquals(1.0 / 3.0, outcome.results().get(1).vectorScore(), 1e-6);
    }
}
