package eu.virtualparadox.hybridrag.ingest.dedup;

import eu.virtualparadox.hybridrag.exception.IndexCorruptionException;
import eu.virtualparadox.hybridrag.exception.InvalidConfigurationException;
import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.util.VectorUtil;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * Removes near-duplicate units from one freshly embedded batch.
 * <p>
 * Every pair {@code (i, j)} with {@code i < j} whose cosine similarity reaches the threshold
 * drops {@code j}; the earlier unit always wins. Pairs involving an already dropped unit are
 * skipped, so the outcome only depends on the input order. Deduplication is batch-local:
 * nothing already in the index is consulted.
 * <p>
 * Quadratic in the batch size.
 */
@Slf4j
@Component
public class SemanticDeduplicator {

    private final double duplicateThreshold;

    public SemanticDeduplicator(@Value("${hybridrag.duplicate-threshold:0.93}") final double duplicateThreshold) {
        if (Double.isNaN(duplicateThreshold) || duplicateThreshold < 0.0 || duplicateThreshold > 1.0) {
            throw new InvalidConfigurationException("duplicateThreshold must be within [0, 1]");
        }
        this.duplicateThreshold = duplicateThreshold;
    }

    /**
     * @param units      batch of units
     * @param embeddings one embedding per unit, same order and dimension
     * @return kept units and embeddings in original relative order
     * @throws IndexCorruptionException if sizes or dimensions disagree
     */
    public DeduplicationResult deduplicate(final List<RetrievalUnit> units, final List<float[]> embeddings) {
        if (units.size() != embeddings.size()) {
            throw new IndexCorruptionException(
                    "Cannot deduplicate " + units.size() + " units with " + embeddings.size() + " embeddings");
        }
        final int n = units.size();
        if (n == 0) {
            return new DeduplicationResult(List.of(), List.of(), 0);
        }

        final int dim = embeddings.get(0).length;
        for (final float[] e : embeddings) {
            if (e == null || e.length != dim) {
                throw new IndexCorruptionException("All embeddings of a batch must have dimension " + dim);
            }
        }

        final BitSet dropped = new BitSet(n);
        for (int i = 0; i < n; i++) {
            if (dropped.get(i)) {
                continue;
            }
            final float[] a = embeddings.get(i);
            for (int j = i + 1; j < n; j++) {
                if (!dropped.get(j) && cosine(a, embeddings.get(j)) >= duplicateThreshold) {
                    dropped.set(j);
                }
            }
        }

        final List<RetrievalUnit> keptUnits = new ArrayList<>(n - dropped.cardinality());
        final List<float[]> keptEmbeddings = new ArrayList<>(n - dropped.cardinality());
        for (int i = 0; i < n; i++) {
            if (!dropped.get(i)) {
                keptUnits.add(units.get(i));
                keptEmbeddings.add(embeddings.get(i));
            }
        }

        log.info("Semantic dedup (threshold={}): kept {} of {} units, removed {}",
                duplicateThreshold, keptUnits.size(), n, dropped.cardinality());
        return new DeduplicationResult(keptUnits, keptEmbeddings, dropped.cardinality());
    }

    /**
     * Cosine similarity; zero vectors have no direction and never count as duplicates.
     */
    public static double cosine(final float[] a, final float[] b) {
        final double normProduct = Math.sqrt((double) VectorUtil.dotProduct(a, a) * VectorUtil.dotProduct(b, b));
        if (normProduct == 0.0) {
            return 0.0;
        }
        return VectorUtil.dotProduct(a, b) / normProduct;
    }
}
