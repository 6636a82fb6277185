package eu.virtualparadox.hybridrag.rag.retriever.service;

import eu.virtualparadox.hybridrag.rag.retriever.model.RetrievalOutcome;
import eu.virtualparadox.hybridrag.rag.retriever.model.SearchResult;

import java.util.List;

public interface RetrieverService {

    /**
     * Retrieves the final evidence list with the configured candidate count, weighting and cut-off.
     */
    RetrievalOutcome retrieve(final String query);

    RetrievalOutcome hybridSearch(final String query, final int k, final double alpha);

    List<SearchResult> filterAndDeduplicate(final List<SearchResult> results, final int finalK);
}
