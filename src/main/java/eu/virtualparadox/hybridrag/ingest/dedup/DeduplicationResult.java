package eu.virtualparadox.hybridrag.ingest.dedup;

import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;

import java.util.List;

/**
 * Units that survived deduplication together with their embeddings, positionally aligned.
 *
 * @param units      kept units in original relative order
 * @param embeddings embeddings of the kept units, same order
 * @param removed    number of units dropped as near-duplicates
 */
public record DeduplicationResult(List<RetrievalUnit> units, List<float[]> embeddings, int removed) {

    public DeduplicationResult {
        units = List.copyOf(units);
        embeddings = List.copyOf(embeddings);
    }
}
