package eu.virtualparadox.hybridrag.rag.retriever.model;

import java.util.List;

/**
 * Ranked evidence for one query.
 * <p>An empty result list means no unit matched; failures are exceptions, never an empty outcome.</p>
 *
 * @param results           ranked results, rank 1 first
 * @param mode              which signals contributed
 * @param degradationReason why the vector signal was missing, {@code null} in {@link RetrievalMode#HYBRID}
 */
public record RetrievalOutcome(List<SearchResult> results, RetrievalMode mode, String degradationReason) {

    public RetrievalOutcome {
        results = List.copyOf(results);
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public boolean isDegraded() {
        return mode == RetrievalMode.KEYWORD_ONLY;
    }

    public RetrievalOutcome withResults(final List<SearchResult> newResults) {
        return new RetrievalOutcome(newResults, mode, degradationReason);
    }
}
