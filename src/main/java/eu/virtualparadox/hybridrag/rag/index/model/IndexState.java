package eu.virtualparadox.hybridrag.rag.index.model;

/**
 * Lifecycle of the live index handle.
 */
public enum IndexState {
    /** Nothing created or loaded yet. */
    EMPTY,
    /** Loaded from disk and unchanged since. */
    LOADED,
    /** Holds mutations that are not on disk. */
    DIRTY,
    /** Current content has been saved. */
    PERSISTED
}
