package eu.virtualparadox.hybridrag.ingest.model;

/**
 * One page of extracted plain text, before cleaning and chunking.
 *
 * @param sourceId   originating document (file name)
 * @param pageNumber 1-based page number
 * @param text       raw page text
 */
public record RawPage(String sourceId, int pageNumber, String text) {
}
