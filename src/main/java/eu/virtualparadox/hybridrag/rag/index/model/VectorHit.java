package eu.virtualparadox.hybridrag.rag.index.model;

/**
 * One nearest-neighbour match.
 *
 * @param unit       matched unit
 * @param distance   squared Euclidean distance to the query
 * @param similarity {@code 1 / (1 + distance)}, in {@code (0, 1]}
 */
public record VectorHit(RetrievalUnit unit, double distance, double similarity) {

    public static VectorHit of(final RetrievalUnit unit, final double distance) {
        return new VectorHit(unit, distance, 1.0 / (1.0 + distance));
    }
}
