package eu.virtualparadox.hybridrag.curated.service;

import eu.virtualparadox.hybridrag.curated.model.CuratedRecord;
import eu.virtualparadox.hybridrag.exception.EmbeddingProviderException;
import eu.virtualparadox.hybridrag.rag.index.CorpusMutationService;
import eu.virtualparadox.hybridrag.rag.index.VectorIndexService;
import eu.virtualparadox.hybridrag.rag.index.model.IndexState;
import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Keeps the curated records in the index in line with the curated store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CuratedRecordIntegrationService {

    private final CuratedRecordStore curatedRecordStore;
    private final CorpusMutationService corpusMutationService;
    private final VectorIndexService vectorIndexService;

    /**
     * Rebuilds the index over the document chunks and the full approved set.
     * <p>
     * A failure is only logged. When embedding fails the previous index keeps serving; when
     * only the save fails the rebuilt index is live but unsaved.
     *
     * @return {@code true} if the index now reflects the approved set and is persisted
     */
    public boolean reloadCuratedRecords() {
        final List<CuratedRecord> approved = curatedRecordStore.listApproved();
        final boolean indexHasCurated = vectorIndexService.snapshot().units().stream().anyMatch(RetrievalUnit::isCurated);
        if (approved.isEmpty() && !indexHasCurated) {
            log.info("No curated records to integrate");
            return true;
        }

        try {
            log.info("Integrating {} curated records into the index", approved.size());
            corpusMutationService.rebuild(approved);
            return true;
        } catch (EmbeddingProviderException | UncheckedIOException e) {
            if (vectorIndexService.state() == IndexState.DIRTY) {
                // replace() already swapped the rebuilt snapshot in; only the save failed
                log.warn("Curated records are integrated but the index could not be saved, serving it unsaved: {}",
                        e.getMessage(), e);
            } else {
                log.warn("Curated record integration failed, the previous index keeps serving: {}", e.getMessage(), e);
            }
            return false;
        }
    }

    /**
     * Stores a newly approved record, appends it to the live index and persists the index.
     *
     * @return the indexed unit
     */
    public RetrievalUnit addRecord(final String question, final String answer) {
        final CuratedRecord saved = curatedRecordStore.save(question, answer);
        final RetrievalUnit unit = corpusMutationService.appendRecord(saved.question(), saved.answer());
        corpusMutationService.persist();
        return unit;
    }
}
