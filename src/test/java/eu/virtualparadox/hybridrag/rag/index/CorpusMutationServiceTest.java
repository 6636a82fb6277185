package eu.virtualparadox.hybridrag.rag.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.hybridrag.application.config.RetrievalProperties;
import eu.virtualparadox.hybridrag.curated.model.CuratedRecord;
import eu.virtualparadox.hybridrag.exception.EmbeddingProviderException;
import eu.virtualparadox.hybridrag.rag.embed.EmbeddingService;
import eu.virtualparadox.hybridrag.rag.index.model.IndexSnapshot;
import eu.virtualparadox.hybridrag.rag.index.model.IndexState;
import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;
import eu.virtualparadox.hybridrag.rag.index.model.UnitKind;
import eu.virtualparadox.hybridrag.rag.index.store.LuceneIndexStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CorpusMutationServiceTest {

    @TempDir
    Path indexDir;

    @Mock
    private EmbeddingService embeddingService;

    private LuceneVectorIndexService vectorIndexService;
    private CorpusMutationService mutator;

    @BeforeEach
    void setUp() {
        RetrievalProperties props = new RetrievalProperties();
        props.setIndex(indexDir);
        vectorIndexService = newIndexService();
        mutator = new CorpusMutationService(embeddingService, vectorIndexService, props);

        vectorIndexService.create(
                List.of(new float[]{1f, 0f}, new float[]{0f, 1f}, new float[]{1f, 1f}),
                List.of(RetrievalUnit.documentChunk("Chapter one text.", "a.pdf", 1),
                        RetrievalUnit.documentChunk("Chapter two text.", "a.pdf", 2),
                        RetrievalUnit.curatedRecord("Old question?", "Old answer.")));
    }

    private static LuceneVectorIndexService newIndexService() {
        return new LuceneVectorIndexService(new LuceneIndexStore(new ObjectMapper()));
    }

    /** Returns one 2-d vector per requested text. */
    private void embedAnything() {
        when(embeddingService.embed(anyList())).thenAnswer(invocation -> {
            List<String> texts = invocation.getArgument(0);
            List<float[]> vectors = new ArrayList<>();
            for (int i = 0; i < texts.size(); i++) {
                vectors.add(new float[]{i, 1f});
            }
            return vectors;
        });
    }

    @Test
    @DisplayName("appendRecord embeds the canonical text and appends without touching existing units")
    void appendRecord() {
        embedAnything();
        IndexSnapshot before = vectorIndexService.snapshot();

        RetrievalUnit appended = mutator.appendRecord("費用は？", "500ドルです。");

        assertEquals(3L, appended.id());
        assertEquals(UnitKind.CURATED_RECORD, appended.kind());
        assertEquals("質問: 費用は？\n回答: 500ドルです。", appended.text());
        assertEquals(IndexState.DIRTY, vectorIndexService.state());
        assertThat(vectorIndexService.snapshot().units().subList(0, 3)).isEqualTo(before.units());
        verify(embeddingService).embed(List.of("質問: 費用は？\n回答: 500ドルです。"));
    }

    @Test
    @DisplayName("rebuild keeps document chunks, replaces curated units and persists")
    void rebuild() {
        embedAnything();
        List<CuratedRecord> curated = List.of(
                new CuratedRecord("Q1?", "A1.", Instant.now()),
                new CuratedRecord("Q2?", "A2.", Instant.now()));

        IndexSnapshot rebuilt = mutator.rebuild(curated);

        assertThat(rebuilt.units()).extracting(RetrievalUnit::text).containsExactly(
                "Chapter one text.", "Chapter two text.", "質問: Q1?\n回答: A1.", "質問: Q2?\n回答: A2.");
        assertThat(rebuilt.units()).extracting(RetrievalUnit::id).containsExactly(0L, 1L, 2L, 3L);
        assertEquals(IndexState.PERSISTED, vectorIndexService.state());
        verify(embeddingService, times(1)).embed(anyList());

        LuceneVectorIndexService reloaded = newIndexService();
        assertEquals(4, reloaded.load(indexDir).size());
    }

    @Test
    @DisplayName("rebuild with no curated records drops the stale ones")
    void rebuildEmptyCuratedSet() {
        embedAnything();

        IndexSnapshot rebuilt = mutator.rebuild(List.of());

        assertThat(rebuilt.units()).noneMatch(RetrievalUnit::isCurated);
        assertEquals(2, rebuilt.size());
    }

    @Test
    @DisplayName("A failed rebuild leaves the live index untouched")
    void rebuildFailure() {
        when(embeddingService.embed(anyList())).thenThrow(new EmbeddingProviderException("offline"));
        IndexSnapshot before = vectorIndexService.snapshot();

        assertThrows(EmbeddingProviderException.class,
                () -> mutator.rebuild(List.of(new CuratedRecord("Q?", "A.", Instant.now()))));

        assertSame(before, vectorIndexService.snapshot());
        assertEquals(IndexState.DIRTY, vectorIndexService.state());
    }

    @Test
    @DisplayName("persist saves the current snapshot")
    void persist() {
        mutator.persist();

        assertEquals(IndexState.PERSISTED, vectorIndexService.state());
        assertEquals(3, newIndexService().load(indexDir).size());
    }

    @Test
    @DisplayName("initialize publishes and saves a fresh index")
    void initialize() {
        IndexSnapshot snapshot = mutator.initialize(
                List.of(new float[]{0.5f, 0.5f}),
                List.of(RetrievalUnit.documentChunk("Only chunk text.", "b.pdf", 1)));

        assertEquals(1, snapshot.size());
        assertEquals(IndexState.PERSISTED, vectorIndexService.state());
        assertEquals(1, newIndexService().load(indexDir).size());
    }
}
