package eu.virtualparadox.hybridrag.application.config;

import eu.virtualparadox.hybridrag.exception.InvalidConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Configuration surface of the retrieval core, bound from {@code hybridrag.*}.
 * <p>Validated once at startup; invalid combinations fail the context instead of being clamped.</p>
 */
@Configuration
@ConfigurationProperties(prefix = "hybridrag")
@Getter @Setter
public class RetrievalProperties {

    private int chunkSize = 800;
    private int chunkOverlap = 100;
    private int minSegmentLength = 10;

    /** Cosine similarity at which a later chunk of the same batch is dropped. */
    private double duplicateThreshold = 0.93;

    /** Character-set Jaccard similarity at which a lower-ranked result is dropped at query time. */
    private double queryDuplicateThreshold = 0.9;

    /** Cosine similarity between query and curated question at which the curated answer is used directly. */
    private double curatedMatchThreshold = 0.85;

    private int topKCandidates = 10;
    private int finalK = 5;

    /** Vector weight in the fused score; 0.3 favours keyword matches. */
    private double hybridAlpha = 0.3;

    private Path index;
    private Path documents;
    private Path models;

    private Embedding embedding = new Embedding();
    private Bootstrap bootstrap = new Bootstrap();

    @Getter @Setter
    public static class Embedding {
        private int batchSize = 32;
    }

    @Getter @Setter
    public static class Bootstrap {
        private boolean enabled = true;
    }

    @PostConstruct
    public void validate() throws IOException {
        if (chunkSize <= 0) {
            throw new InvalidConfigurationException("hybridrag.chunk-size must be positive, was " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new InvalidConfigurationException("hybridrag.chunk-overlap must be in [0, chunk-size), was " + chunkOverlap);
        }
        if (minSegmentLength < 0) {
            throw new InvalidConfigurationException("hybridrag.min-segment-length must not be negative");
        }
        requireUnitInterval("hybridrag.duplicate-threshold", duplicateThreshold);
        requireUnitInterval("hybridrag.query-duplicate-threshold", queryDuplicateThreshold);
        requireUnitInterval("hybridrag.hybrid-alpha", hybridAlpha);
        requireUnitInterval("hybridrag.curated-match-threshold", curatedMatchThreshold);
        if (topKCandidates <= 0 || finalK <= 0) {
            throw new InvalidConfigurationException("hybridrag.top-k-candidates and hybridrag.final-k must be positive");
        }
        if (embedding.batchSize <= 0) {
            throw new InvalidConfigurationException("hybridrag.embedding.batch-size must be positive");
        }

        if (index != null) Files.createDirectories(index);
        if (documents != null) Files.createDirectories(documents);
        if (models != null) Files.createDirectories(models);
    }

    private static void requireUnitInterval(final String name, final double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidConfigurationException(name + " must be within [0, 1], was " + value);
        }
    }
}
