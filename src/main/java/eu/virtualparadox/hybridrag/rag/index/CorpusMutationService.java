package eu.virtualparadox.hybridrag.rag.index;

import eu.virtualparadox.hybridrag.application.config.RetrievalProperties;
import eu.virtualparadox.hybridrag.curated.model.CuratedRecord;
import eu.virtualparadox.hybridrag.exception.IndexCorruptionException;
import eu.virtualparadox.hybridrag.rag.embed.EmbeddingService;
import eu.virtualparadox.hybridrag.rag.index.model.IndexSnapshot;
import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrates every change to the live corpus:
 * <ol>
 *     <li>Initial build from freshly ingested document chunks</li>
 *     <li>Incremental append of a single curated record</li>
 *     <li>Full rebuild over the document chunks plus the current curated set</li>
 *     <li>Persisting the live snapshot to {@code hybridrag.index}</li>
 * </ol>
 * <p>
 * All mutations run under one lock, so embedding, swapping and saving of one mutation never
 * interleave with another. Searches are not affected by the lock: they keep reading whichever
 * snapshot was published last.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorpusMutationService {

    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;
    private final RetrievalProperties props;

    private final ReentrantLock mutationLock = new ReentrantLock();

    /**
     * Publishes a new index over already embedded units and persists it.
     *
     * @param embeddings one vector per unit
     * @param units      units, typically deduplicated document chunks
     * @return the published snapshot
     */
    public IndexSnapshot initialize(final List<float[]> embeddings, final List<RetrievalUnit> units) {
        mutationLock.lock();
        try {
            final IndexSnapshot snapshot = vectorIndexService.create(embeddings, units);
            vectorIndexService.save(props.getIndex());
            return snapshot;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Embeds one curated record and appends it to the live index. Existing vectors are not touched.
     * The index is left dirty; call {@link #persist()} to save it.
     *
     * @param question approved question
     * @param answer   approved answer
     * @return the appended unit with its assigned id
     * @throws eu.virtualparadox.hybridrag.exception.EmbeddingProviderException if the record cannot be embedded
     */
    public RetrievalUnit appendRecord(final String question, final String answer) {
        final RetrievalUnit unit = RetrievalUnit.curatedRecord(question, answer);

        mutationLock.lock();
        try {
            final List<float[]> vectors = embeddingService.embed(List.of(unit.text()));
            if (vectors.size() != 1) {
                throw new IndexCorruptionException("Expected one embedding for a curated record, got " + vectors.size());
            }
            final RetrievalUnit stored = vectorIndexService.append(vectors.get(0), unit);
            log.info("Appended curated record {} to the live index (size {})", stored.id(), vectorIndexService.size());
            return stored;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Rebuilds the index from the document chunks currently indexed plus {@code curatedRecords},
     * replacing any curated units already present, then persists it.
     * <p>
     * Every retained text is re-embedded in one batch. The replacement is built off to the side;
     * searches keep using the previous snapshot until it is swapped in.
     *
     * @param curatedRecords the complete current curated set
     * @return the published snapshot
     * @throws eu.virtualparadox.hybridrag.exception.EmbeddingProviderException if embedding fails; the live index is left untouched
     */
    public IndexSnapshot rebuild(final List<CuratedRecord> curatedRecords) {
        mutationLock.lock();
        try {
            final IndexSnapshot current = vectorIndexService.snapshot();

            final List<RetrievalUnit> units = new ArrayList<>(current.size() + curatedRecords.size());
            int droppedCurated = 0;
            for (final RetrievalUnit unit : current.units()) {
                if (unit.isCurated()) {
                    droppedCurated++;
                } else {
                    units.add(unit);
                }
            }
            final int documentChunks = units.size();
            for (final CuratedRecord record : curatedRecords) {
                units.add(record.toUnit());
            }

            final List<String> texts = units.stream().map(RetrievalUnit::text).toList();
            final List<float[]> embeddings = texts.isEmpty() ? List.of() : embeddingService.embed(texts);

            final IndexSnapshot rebuilt = vectorIndexService.replace(embeddings, units);
            vectorIndexService.save(props.getIndex());

            log.info("Rebuilt index: {} document chunks, {} curated records (replaced {})",
                    documentChunks, curatedRecords.size(), droppedCurated);
            return rebuilt;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Saves the live snapshot to {@code hybridrag.index}.
     */
    public void persist() {
        mutationLock.lock();
        try {
            vectorIndexService.save(props.getIndex());
        } finally {
            mutationLock.unlock();
        }
    }
}
