package eu.virtualparadox.hybridrag.rag.keyword.model;

import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;

import java.util.List;

/**
 * @param unit            matched unit
 * @param score           keyword score in {@code (0, 1]}
 * @param matchedKeywords query keywords found in the unit text
 */
public record KeywordHit(RetrievalUnit unit, double score, List<String> matchedKeywords) {

    public KeywordHit {
        matchedKeywords = List.copyOf(matchedKeywords);
    }
}
