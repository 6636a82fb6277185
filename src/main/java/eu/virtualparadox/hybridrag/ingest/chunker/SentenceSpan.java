package eu.virtualparadox.hybridrag.ingest.chunker;

/**
 * Half-open span {@code [start, end)} of one sentence-like segment in the page text.
 */
record SentenceSpan(int start, int end) {

    SentenceSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid span [" + start + ", " + end + ")");
        }
    }
}
