package eu.virtualparadox.hybridrag.rag.retriever.model;

public enum RetrievalMode {
    /** Vector and keyword signals were both available. */
    HYBRID,
    /** The query could not be embedded; ranking used keyword scores only. */
    KEYWORD_ONLY
}
