package eu.virtualparadox.hybridrag.rag.retriever.model;

import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;

/**
 * @param unit          the retrieved unit
 * @param vectorScore   vector similarity in {@code (0, 1]}, {@code 0} when the unit was not a vector candidate
 * @param keywordScore  keyword score in {@code [0, 1]}, {@code 0} when the unit was not a keyword candidate
 * @param combinedScore {@code alpha * vectorScore + (1 - alpha) * keywordScore}
 * @param rank          1-based position in the list it belongs to
 */
public record SearchResult(RetrievalUnit unit,
                           double vectorScore,
                           double keywordScore,
                           double combinedScore,
                           int rank) {

    public SearchResult withRank(final int newRank) {
        return new SearchResult(unit, vectorScore, keywordScore, combinedScore, newRank);
    }

    public String text() {
        return unit.text();
    }
}
