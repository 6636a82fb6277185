package eu.virtualparadox.hybridrag.rag.embed;

import eu.virtualparadox.hybridrag.exception.EmbeddingProviderException;

import java.util.List;

/**
 * Computes dense vector embeddings for texts.
 * <p>
 * Implementations are deterministic: the same text always yields the same vector, and all
 * vectors of one provider share a fixed dimension.
 */
public interface EmbeddingService {

    /**
     * Embeds the given texts in batch.
     *
     * @param texts texts to embed
     * @return one vector per text, same order
     * @throws EmbeddingProviderException if the provider is unavailable or fails
     */
    List<float[]> embed(List<String> texts);

    /**
     * Embeds a single query string.
     *
     * @param text the query string (non-null, non-blank)
     * @return a dense vector representation of the query
     * @throws EmbeddingProviderException if the provider is unavailable or fails
     */
    default float[] embedQuery(final String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        return embed(List.of(text)).get(0);
    }

    /**
     * @return {@code false} when calls are known to fail, e.g. because no model is installed
     */
    default boolean isAvailable() {
        return true;
    }
}
