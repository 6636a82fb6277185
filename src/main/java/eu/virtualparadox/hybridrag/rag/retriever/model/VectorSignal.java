package eu.virtualparadox.hybridrag.rag.retriever.model;

import eu.virtualparadox.hybridrag.rag.index.model.VectorHit;

import java.util.List;

/**
 * Outcome of the semantic half of a hybrid query: either the vector hits, or the reason they
 * are missing.
 *
 * @param hits              nearest neighbours, empty when degraded
 * @param degradationReason {@code null} unless degraded
 */
public record VectorSignal(List<VectorHit> hits, String degradationReason) {

    public VectorSignal {
        hits = List.copyOf(hits);
    }

    public static VectorSignal ok(final List<VectorHit> hits) {
        return new VectorSignal(hits, null);
    }

    public static VectorSignal degraded(final String reason) {
        return new VectorSignal(List.of(), reason == null || reason.isBlank() ? "vector search unavailable" : reason);
    }

    public boolean isDegraded() {
        return degradationReason != null;
    }
}
