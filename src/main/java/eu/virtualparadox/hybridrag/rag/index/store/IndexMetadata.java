package eu.virtualparadox.hybridrag.rag.index.store;

import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;

import java.util.List;

/**
 * Content of {@code units.json}: everything about a generation except the vectors.
 *
 * @param formatVersion layout version, bumped on incompatible changes
 * @param dimension     vector dimension, {@code 0} for an empty index
 * @param nextId        next free unit id
 * @param units         units in position order
 */
public record IndexMetadata(int formatVersion, int dimension, long nextId, List<RetrievalUnit> units) {

    public static final int CURRENT_FORMAT = 1;
}
