package eu.virtualparadox.hybridrag.rag.retriever.service;

import eu.virtualparadox.hybridrag.application.config.RetrievalProperties;
import eu.virtualparadox.hybridrag.exception.EmbeddingProviderException;
import eu.virtualparadox.hybridrag.rag.embed.EmbeddingService;
import eu.virtualparadox.hybridrag.rag.index.VectorIndexService;
import eu.virtualparadox.hybridrag.rag.index.model.IndexSnapshot;
import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;
import eu.virtualparadox.hybridrag.rag.index.model.VectorHit;
import eu.virtualparadox.hybridrag.rag.keyword.KeywordIndexService;
import eu.virtualparadox.hybridrag.rag.keyword.model.KeywordHit;
import eu.virtualparadox.hybridrag.rag.retriever.model.RetrievalMode;
import eu.virtualparadox.hybridrag.rag.retriever.model.RetrievalOutcome;
import eu.virtualparadox.hybridrag.rag.retriever.model.SearchResult;
import eu.virtualparadox.hybridrag.rag.retriever.model.VectorSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Hybrid retriever: fuses exact vector similarity with lexical keyword scores.
 * <p>
 * Steps:
 * <ol>
 *   <li>Pin the current index snapshot so both signals see the same units</li>
 *   <li>Embed the query and take the {@code 2k} nearest units; on provider failure continue keyword-only</li>
 *   <li>Take the {@code 2k} best keyword matches</li>
 *   <li>Join both candidate sets on unit id and fuse linearly with weight {@code alpha}</li>
 *   <li>Return the top {@code k} with a positive fused score</li>
 * </ol>
 * {@link #filterAndDeduplicate(List, int)} then removes near-identical passages by character-set
 * Jaccard similarity before the list is handed on.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class HybridRetrieverService implements RetrieverService {

    private static final int CANDIDATE_FACTOR = 2;
    private static final Pattern PUNCTUATION = Pattern.compile("\\p{P}");

    private static final Comparator<SearchResult> BY_COMBINED_SCORE =
            Comparator.comparingDouble(SearchResult::combinedScore).reversed()
                    .thenComparingLong(r -> r.unit().id());

    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;
    private final KeywordIndexService keywordIndexService;
    private final RetrievalProperties props;

    @Override
    public RetrievalOutcome retrieve(final String query) {
        final RetrievalOutcome candidates = hybridSearch(query, props.getTopKCandidates(), props.getHybridAlpha());
        final List<SearchResult> finalResults = filterAndDeduplicate(candidates.results(), props.getFinalK());

        if (finalResults.isEmpty()) {
            log.info("No evidence found for query: {}", query);
        }
        return candidates.withResults(finalResults);
    }

    /**
     * Executes hybrid semantic + keyword search.
     *
     * @param query user query string
     * @param k     maximum number of results (must be {@code > 0})
     * @param alpha vector weight in {@code [0, 1]}; {@code 1} is pure vector, {@code 0} pure keyword ranking
     * @return fused results, ranked from 1; degraded to keyword-only when the query cannot be embedded
     */
    @Override
    public RetrievalOutcome hybridSearch(final String query, final int k, final double alpha) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive");
        }
        if (Double.isNaN(alpha) || alpha < 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("alpha must be within [0, 1], was " + alpha);
        }
        if (query == null || query.isBlank()) {
            return new RetrievalOutcome(List.of(), RetrievalMode.HYBRID, null);
        }

        final IndexSnapshot snapshot = vectorIndexService.snapshot();
        final int candidates = k * CANDIDATE_FACTOR;

        final VectorSignal vectorSignal = vectorSignal(snapshot, query, candidates);
        final double effectiveAlpha = vectorSignal.isDegraded() ? 0.0 : alpha;
        final List<KeywordHit> keywordHits = keywordIndexService.score(snapshot, query, candidates);

        // unit id -> [vectorScore, keywordScore]
        final Map<Long, double[]> scores = new LinkedHashMap<>();
        final Map<Long, RetrievalUnit> units = new LinkedHashMap<>();
        for (final VectorHit hit : vectorSignal.hits()) {
            units.put(hit.unit().id(), hit.unit());
            scores.computeIfAbsent(hit.unit().id(), id -> new double[2])[0] = hit.similarity();
        }
        for (final KeywordHit hit : keywordHits) {
            units.putIfAbsent(hit.unit().id(), hit.unit());
            scores.computeIfAbsent(hit.unit().id(), id -> new double[2])[1] = hit.score();
        }

        final List<SearchResult> fused = new ArrayList<>(scores.size());
        for (final Map.Entry<Long, double[]> e : scores.entrySet()) {
            final double vectorScore = e.getValue()[0];
            final double keywordScore = e.getValue()[1];
            final double combined = effectiveAlpha * vectorScore + (1.0 - effectiveAlpha) * keywordScore;
            if (combined > 0.0) {
                fused.add(new SearchResult(units.get(e.getKey()), vectorScore, keywordScore, combined, 0));
            }
        }
        fused.sort(BY_COMBINED_SCORE);

        final List<SearchResult> top = rank(fused.subList(0, Math.min(k, fused.size())));
        log.debug("Hybrid search '{}' (k={}, alpha={}): vector={}, keyword={}, fused={}, returned={}",
                query, k, effectiveAlpha, vectorSignal.hits().size(), keywordHits.size(), fused.size(), top.size());

        return vectorSignal.isDegraded()
                ? new RetrievalOutcome(top, RetrievalMode.KEYWORD_ONLY, vectorSignal.degradationReason())
                : new RetrievalOutcome(top, RetrievalMode.HYBRID, null);
    }

    /**
     * Keeps a result only if its normalised text is less than
     * {@code hybridrag.query-duplicate-threshold} Jaccard-similar to every result kept before it.
     *
     * @param results candidate results in any order
     * @param finalK  maximum number of results to keep (must be {@code > 0})
     * @return kept results by descending combined score, re-ranked from 1
     */
    @Override
    public List<SearchResult> filterAndDeduplicate(final List<SearchResult> results, final int finalK) {
        if (finalK <= 0) {
            throw new IllegalArgumentException("finalK must be positive");
        }

        final List<SearchResult> sorted = new ArrayList<>(results);
        sorted.sort(BY_COMBINED_SCORE);

        final List<SearchResult> kept = new ArrayList<>();
        final List<Set<Integer>> keptCharSets = new ArrayList<>();
        for (final SearchResult result : sorted) {
            final Set<Integer> chars = charSet(normalize(result.text()));

            boolean duplicate = false;
            for (final Set<Integer> seen : keptCharSets) {
                if (jaccard(chars, seen) >= props.getQueryDuplicateThreshold()) {
                    duplicate = true;
                    break;
                }
            }
            if (duplicate) {
                log.debug("Dropping near-duplicate result unit={} from {}", result.unit().id(), result.unit().sourceId());
                continue;
            }

            kept.add(result);
            keptCharSets.add(chars);
            if (kept.size() >= finalK) {
                break;
            }
        }
        return rank(kept);
    }

    private VectorSignal vectorSignal(final IndexSnapshot snapshot, final String query, final int candidates) {
        if (snapshot.isEmpty()) {
            return VectorSignal.ok(List.of());
        }
        try {
            final float[] queryVector = embeddingService.embedQuery(query);
            if (queryVector == null || queryVector.length != snapshot.dimension()) {
                throw new EmbeddingProviderException("Query embedding has dimension "
                        + (queryVector == null ? "null" : queryVector.length)
                        + " but the index was built with dimension " + snapshot.dimension());
            }
            return VectorSignal.ok(snapshot.search(queryVector, candidates));
        } catch (final RuntimeException e) {
            // keyword retrieval survives any vector-side failure
            final String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Vector search failed, falling back to keyword-only retrieval: {}", reason, e);
            return VectorSignal.degraded(reason);
        }
    }

    /**
     * Lower-cases, drops punctuation and trims, so that passages differing only in sentence
     * punctuation compare as equal.
     */
    static String normalize(final String text) {
        return PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("").trim();
    }

    static Set<Integer> charSet(final String text) {
        return text.codePoints().boxed().collect(Collectors.toCollection(HashSet::new));
    }

    /**
     * @return {@code |a ∩ b| / |a ∪ b|}, {@code 0} when either set is empty
     */
    static double jaccard(final Set<Integer> a, final Set<Integer> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (final Integer c : a) {
            if (b.contains(c)) {
                intersection++;
            }
        }
        final int union = a.size() + b.size() - intersection;
        return (double) intersection / union;
    }

    private static List<SearchResult> rank(final List<SearchResult> results) {
        final List<SearchResult> ranked = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            ranked.add(results.get(i).withRank(i + 1));
        }
        return List.copyOf(ranked);
    }
}
