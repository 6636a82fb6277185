package eu.virtualparadox.hybridrag.exception;

/**
 * Signals that the units and vectors of an index are no longer positionally aligned:
 * count mismatch, dimension mismatch or a missing metadata file.
 * <p>Never repaired automatically; always surfaced to the caller.</p>
 */
public class IndexCorruptionException extends IllegalStateException {

    public IndexCorruptionException(final String message) {
        super(message);
    }

    public IndexCorruptionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
