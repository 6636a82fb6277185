package eu.virtualparadox.hybridrag.rag.index;

import eu.virtualparadox.hybridrag.rag.index.model.IndexSnapshot;
import eu.virtualparadox.hybridrag.rag.index.model.IndexState;
import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;
import eu.virtualparadox.hybridrag.rag.index.model.VectorHit;

import java.nio.file.Path;
import java.util.List;

/**
 * Owned, versioned handle over the units and vectors being searched.
 * <p>
 * Reads go against the current {@link IndexSnapshot} and never block. Every mutation builds a
 * new snapshot and publishes it atomically, so readers see either the old or the new content,
 * never a half-applied change.
 * <p>
 * Notes:
 * <ul>
 *   <li>All vectors of an index MUST have the same dimension.</li>
 *   <li>Unit ids are assigned here at insertion; ids passed in are ignored.</li>
 * </ul>
 */
public interface VectorIndexService {

    /**
     * Replaces whatever is live with a fresh index over the given pairs; ids become {@code 0..n-1}.
     *
     * @param embeddings one vector per unit, same order and dimension
     * @param units      units to index
     * @return the published snapshot
     * @throws eu.virtualparadox.hybridrag.exception.IndexCorruptionException on count or dimension mismatch
     */
    IndexSnapshot create(List<float[]> embeddings, List<RetrievalUnit> units);

    /**
     * Publishes a replacement built off to the side. Same contract as {@link #create(List, List)};
     * used by rebuilds.
     */
    IndexSnapshot replace(List<float[]> embeddings, List<RetrievalUnit> units);

    /**
     * Exact nearest-neighbour search over the current snapshot.
     *
     * @param queryEmbedding query vector
     * @param k              maximum number of hits (must be {@code > 0})
     * @return hits by ascending distance, ties by insertion order; empty when the index is empty
     */
    List<VectorHit> search(float[] queryEmbedding, int k);

    /**
     * Adds one pair at the end without touching existing units.
     *
     * @return the unit as stored, carrying its assigned id
     */
    RetrievalUnit append(float[] embedding, RetrievalUnit unit);

    /**
     * Writes the current snapshot to {@code path}. The previously saved copy stays intact until
     * the new one is complete.
     */
    void save(Path path);

    /**
     * Loads the index saved at {@code path} and makes it live.
     *
     * @throws eu.virtualparadox.hybridrag.exception.PersistedIndexNotFoundException if nothing was saved there
     * @throws eu.virtualparadox.hybridrag.exception.IndexCorruptionException        if the saved copy is inconsistent
     */
    IndexSnapshot load(Path path);

    IndexSnapshot snapshot();

    IndexState state();

    default int size() {
        return snapshot().size();
    }
}
