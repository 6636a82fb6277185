package eu.virtualparadox.hybridrag.rag.keyword;

import eu.virtualparadox.hybridrag.rag.index.model.IndexSnapshot;
import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;
import eu.virtualparadox.hybridrag.rag.keyword.model.KeywordHit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Lexical scoring over the units of a snapshot.
 * <p>
 * A keyword counts when it occurs literally in the lower-cased unit text, and contributes
 * {@code length / 10}; the sum is capped at {@code 1.0}. Longer keywords, which are rarer and
 * more specific, therefore weigh more. Units without any match are not returned.
 * <p>
 * Scans the whole snapshot on every query; there is no inverted index.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KeywordIndexService {

    private static final double LENGTH_NORMALIZER = 10.0;
    private static final double MAX_SCORE = 1.0;

    private final KeywordExtractor keywordExtractor;

    /**
     * Scores every unit of {@code snapshot} against {@code query}.
     *
     * @param snapshot units to score
     * @param query    user query
     * @param limit    maximum number of hits (must be {@code > 0})
     * @return hits by descending score, ties in insertion order
     */
    public List<KeywordHit> score(final IndexSnapshot snapshot, final String query, final int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }

        final List<String> keywords = keywordExtractor.extract(query);
        if (keywords.isEmpty() || snapshot.isEmpty()) {
            return List.of();
        }
        log.debug("Keywords for '{}': {}", query, keywords);

        final List<KeywordHit> hits = new ArrayList<>();
        for (final RetrievalUnit unit : snapshot.units()) {
            final String text = unit.text().toLowerCase(Locale.ROOT);

            double score = 0.0;
            final List<String> matched = new ArrayList<>();
            for (final String kw : keywords) {
                if (text.contains(kw)) {
                    score += kw.length() / LENGTH_NORMALIZER;
                    matched.add(kw);
                }
            }

            if (score > 0.0) {
                hits.add(new KeywordHit(unit, Math.min(score, MAX_SCORE), matched));
            }
        }

        // List.sort is stable: equal scores keep insertion order
        hits.sort(Comparator.comparingDouble(KeywordHit::score).reversed());
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : List.copyOf(hits);
    }
}
