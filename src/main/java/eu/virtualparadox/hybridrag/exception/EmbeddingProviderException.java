package eu.virtualparadox.hybridrag.exception;

/** The embedding provider is unavailable or failed to embed a batch. */
public class EmbeddingProviderException extends RuntimeException {

    public EmbeddingProviderException(final String message) {
        super(message);
    }

    public EmbeddingProviderException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
