package eu.virtualparadox.hybridrag.curated.service;

import eu.virtualparadox.hybridrag.application.config.RetrievalProperties;
import eu.virtualparadox.hybridrag.curated.model.CuratedMatch;
import eu.virtualparadox.hybridrag.curated.model.CuratedRecord;
import eu.virtualparadox.hybridrag.ingest.dedup.SemanticDeduplicator;
import eu.virtualparadox.hybridrag.rag.embed.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * First stop for a user query: looks for an approved question that means the same thing.
 * <p>
 * The query is compared by cosine similarity with every approved question. The best one
 * counts as a match when it reaches {@code hybridrag.curated-match-threshold}; callers then
 * answer with the stored answer and skip hybrid retrieval. Question embeddings are cached
 * and recomputed whenever the approved set changes.
 * <p>
 * Embedding failures never surface: they are logged and reported as "no match", so the
 * query falls through to hybrid retrieval.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CuratedRecordMatcher {

    private final CuratedRecordStore curatedRecordStore;
    private final EmbeddingService embeddingService;
    private final RetrievalProperties props;

    private volatile QuestionEmbeddings cache;

    /**
     * @param query user query
     * @return the closest approved record at or above the threshold, empty otherwise
     */
    public Optional<CuratedMatch> match(final String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        final List<CuratedRecord> approved = curatedRecordStore.listApproved();
        if (approved.isEmpty()) {
            return Optional.empty();
        }

        try {
            final QuestionEmbeddings questions = questionEmbeddings(approved);
            final float[] queryVector = embeddingService.embedQuery(query);

            int best = -1;
            double bestSimilarity = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < questions.vectors().size(); i++) {
                final float[] v = questions.vectors().get(i);
                if (v.length != queryVector.length) {
                    continue;
                }
                final double similarity = SemanticDeduplicator.cosine(queryVector, v);
                if (similarity > bestSimilarity) {
                    bestSimilarity = similarity;
                    best = i;
                }
            }

            if (best < 0 || bestSimilarity < props.getCuratedMatchThreshold()) {
                log.debug("No curated match for '{}' (best similarity {})", query, bestSimilarity);
                return Optional.empty();
            }
            log.info("Curated match for '{}': '{}' (similarity {})",
                    query, approved.get(best).question(), bestSimilarity);
            return Optional.of(new CuratedMatch(approved.get(best), bestSimilarity));
        } catch (final RuntimeException e) {
            log.warn("Curated record matching failed, falling back to retrieval: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    private QuestionEmbeddings questionEmbeddings(final List<CuratedRecord> approved) {
        final QuestionEmbeddings cached = cache;
        if (cached != null && cached.records().equals(approved)) {
            return cached;
        }
        final List<float[]> vectors = embeddingService.embed(approved.stream().map(CuratedRecord::question).toList());
        if (vectors.size() != approved.size()) {
            throw new IllegalStateException("Expected " + approved.size() + " question embeddings, got " + vectors.size());
        }
        final QuestionEmbeddings fresh = new QuestionEmbeddings(List.copyOf(approved), List.copyOf(vectors));
        cache = fresh;
        log.info("Embedded {} curated questions", approved.size());
        return fresh;
    }

    private record QuestionEmbeddings(List<CuratedRecord> records, List<float[]> vectors) {
    }
}
