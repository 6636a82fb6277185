package eu.virtualparadox.hybridrag.rag.index.model;

public enum UnitKind {
    DOCUMENT_CHUNK,
    CURATED_RECORD
}
