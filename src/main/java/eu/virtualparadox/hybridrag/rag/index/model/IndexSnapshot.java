package eu.virtualparadox.hybridrag.rag.index.model;

import eu.virtualparadox.hybridrag.exception.IndexCorruptionException;
import org.apache.lucene.util.VectorUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable view of the index: units and their vectors, positionally aligned.
 * <p>
 * Every mutation produces a new snapshot; readers holding an older one keep a complete,
 * consistent picture. Position order equals insertion order, and unit ids grow
 * monotonically with position.
 * <p>
 * Search is an exact flat scan ranked by squared Euclidean distance, the metric a flat L2
 * index reports. Ties keep insertion order.
 */
public final class IndexSnapshot {

    private static final IndexSnapshot EMPTY = new IndexSnapshot(List.of(), new float[0][], 0, 0L, 0L);

    private final List<RetrievalUnit> units;
    private final float[][] vectors;
    private final int dimension;
    private final long nextId;
    private final long version;

    private IndexSnapshot(final List<RetrievalUnit> units,
                          final float[][] vectors,
                          final int dimension,
                          final long nextId,
                          final long version) {
        this.units = units;
        this.vectors = vectors;
        this.dimension = dimension;
        this.nextId = nextId;
        this.version = version;
    }

    public static IndexSnapshot empty() {
        return EMPTY;
    }

    /**
     * Builds a fresh snapshot; ids are assigned {@code 0..n-1} in input order.
     *
     * @param embeddings one vector per unit, all of the same dimension
     * @param units      units, ids are overwritten
     * @param version    version stamp of the new snapshot
     * @throws IndexCorruptionException on count or dimension mismatch
     */
    public static IndexSnapshot create(final List<float[]> embeddings,
                                       final List<RetrievalUnit> units,
                                       final long version) {
        if (embeddings.size() != units.size()) {
            throw new IndexCorruptionException(
                    "Embedding count " + embeddings.size() + " does not match unit count " + units.size());
        }
        final int dim = embeddings.isEmpty() ? 0 : requireDimension(embeddings.get(0));

        final List<RetrievalUnit> assigned = new ArrayList<>(units.size());
        final float[][] copies = new float[embeddings.size()][];
        for (int i = 0; i < units.size(); i++) {
            final float[] v = embeddings.get(i);
            checkDimension(v, dim);
            copies[i] = v.clone();
            assigned.add(units.get(i).withId(i));
        }
        return new IndexSnapshot(Collections.unmodifiableList(assigned), copies, dim, units.size(), version);
    }

    /**
     * Rebuilds a snapshot from persisted state; ids are kept as stored.
     *
     * @throws IndexCorruptionException on count or dimension mismatch, or ids out of order
     */
    public static IndexSnapshot restore(final List<RetrievalUnit> units,
                                        final float[][] vectors,
                                        final int dimension,
                                        final long nextId,
                                        final long version) {
        if (units.size() != vectors.length) {
            throw new IndexCorruptionException(
                    "Persisted unit count " + units.size() + " does not match vector count " + vectors.length);
        }
        long previousId = -1L;
        for (int i = 0; i < vectors.length; i++) {
            checkDimension(vectors[i], dimension);
            final long id = units.get(i).id();
            if (id <= previousId || id >= nextId) {
                throw new IndexCorruptionException("Unit id " + id + " at position " + i + " is out of order");
            }
            previousId = id;
        }
        return new IndexSnapshot(List.copyOf(units), vectors.clone(), dimension, nextId, version);
    }

    /**
     * Returns a new snapshot with one more unit at the end.
     *
     * @param embedding vector of the unit; fixes the dimension when this snapshot is empty
     * @param unit      the unit, its id is overwritten with the next free id
     * @param version   version stamp of the new snapshot
     */
    public IndexSnapshot appended(final float[] embedding, final RetrievalUnit unit, final long version) {
        final int dim = units.isEmpty() ? requireDimension(embedding) : dimension;
        checkDimension(embedding, dim);

        final List<RetrievalUnit> grown = new ArrayList<>(units.size() + 1);
        grown.addAll(units);
        grown.add(unit.withId(nextId));

        final float[][] grownVectors = Arrays.copyOf(vectors, vectors.length + 1);
        grownVectors[vectors.length] = embedding.clone();

        return new IndexSnapshot(Collections.unmodifiableList(grown), grownVectors, dim, nextId + 1, version);
    }

    /**
     * Exact k-nearest-neighbour search.
     *
     * @param query query vector of the index dimension
     * @param k     maximum number of hits
     * @return at most {@code k} hits ordered by ascending distance, ties by insertion order
     * @throws IllegalArgumentException if {@code k <= 0} or the query dimension differs
     */
    public List<VectorHit> search(final float[] query, final int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive");
        }
        if (units.isEmpty()) {
            return List.of();
        }
        if (query == null || query.length != dimension) {
            throw new IllegalArgumentException("Query dimension "
                    + (query == null ? "null" : query.length) + " does not match index dimension " + dimension);
        }

        final double[] distances = new double[vectors.length];
        final List<Integer> order = new ArrayList<>(vectors.length);
        for (int i = 0; i < vectors.length; i++) {
            distances[i] = VectorUtil.squareDistance(query, vectors[i]);
            order.add(i);
        }
        // stable sort keeps insertion order for equal distances
        order.sort(Comparator.comparingDouble(i -> distances[i]));

        final int limit = Math.min(k, order.size());
        final List<VectorHit> hits = new ArrayList<>(limit);
        for (int r = 0; r < limit; r++) {
            final int pos = order.get(r);
            hits.add(VectorHit.of(units.get(pos), distances[pos]));
        }
        return hits;
    }

    public List<RetrievalUnit> units() {
        return units;
    }

    /**
     * @return a copy of the vector stored at {@code position}
     */
    public float[] vector(final int position) {
        return vectors[position].clone();
    }

    public int size() {
        return units.size();
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }

    /** Vector dimension, {@code 0} while empty. */
    public int dimension() {
        return dimension;
    }

    public long nextId() {
        return nextId;
    }

    public long version() {
        return version;
    }

    private static int requireDimension(final float[] v) {
        if (v == null || v.length == 0) {
            throw new IndexCorruptionException("Vector dimension must be > 0");
        }
        return v.length;
    }

    private static void checkDimension(final float[] v, final int dim) {
        if (v == null || v.length != dim) {
            throw new IndexCorruptionException("Vector dimension mismatch. Expected=" + dim
                    + ", got=" + (v == null ? "null" : v.length));
        }
    }
}
