package eu.virtualparadox.hybridrag.rag.index.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.hybridrag.exception.IndexCorruptionException;
import eu.virtualparadox.hybridrag.exception.PersistedIndexNotFoundException;
import eu.virtualparadox.hybridrag.rag.index.model.IndexSnapshot;
import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.FloatVectorValues;
import org.apache.lucene.index.IndexNotFoundException;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.LeafReader;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.DocIdSetIterator;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static eu.virtualparadox.hybridrag.util.LuceneConstants.*;

/**
 * Write-then-swap persistence of {@link IndexSnapshot}s.
 *
 * <h3>Layout</h3>
 * <pre>
 * &lt;root&gt;/CURRENT                  name of the live generation
 * &lt;root&gt;/gen-000007/vectors/      Lucene index, one document per unit
 * &lt;root&gt;/gen-000007/units.json    {@link IndexMetadata}
 * </pre>
 * A save always writes a brand-new generation directory and only then replaces {@code CURRENT}
 * with an atomic move. A crash mid-save leaves the previous generation live; older generations
 * are removed on a best-effort basis once the pointer has moved.
 *
 * <h3>Lucene document layout</h3>
 * <ul>
 *   <li>{@code vector} – {@link KnnFloatVectorField} with {@link VectorSimilarityFunction#EUCLIDEAN}</li>
 *   <li>{@code position} – {@link StoredField}: index into {@code units.json}</li>
 *   <li>{@code unitId} – {@link StoredField}: id of the unit, cross-checked on load</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LuceneIndexStore {

    private static final Pattern GENERATION = Pattern.compile(Pattern.quote(GENERATION_PREFIX) + "(\\d{6})");

    /** Temporary file prefix for the pointer swap. */
    private static final String TEMP_FILE_PREFIX = "current-";

    /** Temporary file suffix for the pointer swap. */
    private static final String TEMP_FILE_SUFFIX = ".tmp";

    private final ObjectMapper objectMapper;

    /**
     * Persists a snapshot as a new generation under {@code root} and publishes it.
     *
     * @param root     index root directory, created if missing
     * @param snapshot snapshot to write
     * @throws UncheckedIOException if any file operation fails; the previously published generation stays live
     */
    public void write(final Path root, final IndexSnapshot snapshot) {
        try {
            Files.createDirectories(root);
            final String generation = String.format("%s%06d", GENERATION_PREFIX, latestGeneration(root) + 1);
            final Path genDir = root.resolve(generation);
            Files.createDirectories(genDir);

            writeVectors(genDir.resolve(VECTORS_DIR), snapshot);

            final IndexMetadata metadata = new IndexMetadata(
                    IndexMetadata.CURRENT_FORMAT, snapshot.dimension(), snapshot.nextId(), snapshot.units());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(genDir.resolve(UNITS_FILE).toFile(), metadata);

            final Path temp = Files.createTempFile(root, TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);
            Files.writeString(temp, generation, StandardCharsets.UTF_8);
            Files.move(temp, root.resolve(CURRENT_FILE), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

            log.info("Persisted index generation {} ({} units, dim={}) at {}",
                    generation, snapshot.size(), snapshot.dimension(), root);
            deleteStaleGenerations(root, generation);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist index at " + root, e);
        }
    }

    /**
     * Loads the published generation under {@code root}.
     *
     * @param root    index root directory
     * @param version version stamp for the restored snapshot
     * @return the restored snapshot
     * @throws PersistedIndexNotFoundException if nothing was ever published at {@code root}
     * @throws IndexCorruptionException        if metadata is missing or does not line up with the vectors
     * @throws UncheckedIOException            on unexpected I/O failure
     */
    public IndexSnapshot read(final Path root, final long version) {
        final Path current = root.resolve(CURRENT_FILE);
        if (!Files.isRegularFile(current)) {
            throw new PersistedIndexNotFoundException(root);
        }

        try {
            final String generation = Files.readString(current, StandardCharsets.UTF_8).trim();
            final Path genDir = root.resolve(generation);
            if (!GENERATION.matcher(generation).matches() || !Files.isDirectory(genDir)) {
                throw new IndexCorruptionException("CURRENT points to missing generation '" + generation + "' in " + root);
            }

            final Path unitsFile = genDir.resolve(UNITS_FILE);
            if (!Files.isRegularFile(unitsFile)) {
                throw new IndexCorruptionException("Index metadata " + unitsFile + " is missing");
            }
            final IndexMetadata metadata = readMetadata(unitsFile);
            if (metadata.formatVersion() != IndexMetadata.CURRENT_FORMAT) {
                throw new IndexCorruptionException("Unsupported index format " + metadata.formatVersion());
            }
            final List<RetrievalUnit> units = metadata.units() == null ? List.of() : metadata.units();

            final float[][] vectors = readVectors(genDir.resolve(VECTORS_DIR), units);
            final IndexSnapshot snapshot =
                    IndexSnapshot.restore(units, vectors, metadata.dimension(), metadata.nextId(), version);

            log.info("Loaded index generation {} ({} units, dim={}) from {}",
                    generation, snapshot.size(), snapshot.dimension(), root);
            return snapshot;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load index from " + root, e);
        }
    }

    /**
     * @return {@code true} if a generation has been published at {@code root}
     */
    public boolean exists(final Path root) {
        return Files.isRegularFile(root.resolve(CURRENT_FILE));
    }

    private IndexMetadata readMetadata(final Path unitsFile) throws IOException {
        try {
            return objectMapper.readValue(unitsFile.toFile(), IndexMetadata.class);
        } catch (JsonProcessingException e) {
            throw new IndexCorruptionException("Index metadata " + unitsFile + " is unreadable", e);
        }
    }

    private void writeVectors(final Path vectorsDir, final IndexSnapshot snapshot) throws IOException {
        final IndexWriterConfig cfg = new IndexWriterConfig()
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE);

        try (Directory dir = FSDirectory.open(vectorsDir);
             IndexWriter writer = new IndexWriter(dir, cfg)) {
            final List<RetrievalUnit> units = snapshot.units();
            for (int i = 0; i < units.size(); i++) {
                final Document d = new Document();
                d.add(new KnnFloatVectorField(FIELD_VECTOR, snapshot.vector(i), VectorSimilarityFunction.EUCLIDEAN));
                d.add(new StoredField(FIELD_POSITION, i));
                d.add(new StoredField(FIELD_UNIT_ID, units.get(i).id()));
                writer.addDocument(d);
            }
            writer.commit();
        }
    }

    private float[][] readVectors(final Path vectorsDir, final List<RetrievalUnit> units) throws IOException {
        if (!Files.isDirectory(vectorsDir)) {
            throw new IndexCorruptionException("Vector store " + vectorsDir + " is missing");
        }

        try (Directory dir = FSDirectory.open(vectorsDir);
             DirectoryReader reader = DirectoryReader.open(dir)) {

            if (reader.numDocs() != units.size()) {
                throw new IndexCorruptionException("Vector count " + reader.numDocs()
                        + " does not match unit count " + units.size());
            }

            final float[][] vectors = new float[units.size()][];
            for (final LeafReaderContext ctx : reader.leaves()) {
                final LeafReader leaf = ctx.reader();
                final FloatVectorValues values = leaf.getFloatVectorValues(FIELD_VECTOR);
                if (values == null) {
                    continue;
                }
                final StoredFields storedFields = leaf.storedFields();
                for (int doc = values.nextDoc(); doc != DocIdSetIterator.NO_MORE_DOCS; doc = values.nextDoc()) {
                    final Document stored = storedFields.document(doc);
                    final int position = stored.getField(FIELD_POSITION).numericValue().intValue();
                    final long unitId = stored.getField(FIELD_UNIT_ID).numericValue().longValue();

                    if (position < 0 || position >= vectors.length || vectors[position] != null) {
                        throw new IndexCorruptionException("Invalid or duplicate vector position " + position);
                    }
                    if (units.get(position).id() != unitId) {
                        throw new IndexCorruptionException("Vector at position " + position + " belongs to unit "
                                + unitId + ", metadata says " + units.get(position).id());
                    }
                    vectors[position] = values.vectorValue().clone();
                }
            }

            for (int i = 0; i < vectors.length; i++) {
                if (vectors[i] == null) {
                    throw new IndexCorruptionException("No vector stored for position " + i);
                }
            }
            return vectors;
        } catch (CorruptIndexException | IndexNotFoundException e) {
            throw new IndexCorruptionException("Vector store " + vectorsDir + " is damaged", e);
        }
    }

    private static int latestGeneration(final Path root) throws IOException {
        int latest = 0;
        try (Stream<Path> entries = Files.list(root)) {
            for (final Path p : (Iterable<Path>) entries::iterator) {
                final Matcher m = GENERATION.matcher(p.getFileName().toString());
                if (m.matches() && Files.isDirectory(p)) {
                    latest = Math.max(latest, Integer.parseInt(m.group(1)));
                }
            }
        }
        return latest;
    }

    /**
     * Removes generations other than {@code live}, and pointer temp files left by an
     * interrupted save.
     */
    private static void deleteStaleGenerations(final Path root, final String live) {
        final List<Path> stale = new ArrayList<>();
        final List<Path> strayPointers = new ArrayList<>();
        try (Stream<Path> entries = Files.list(root)) {
            entries.forEach(p -> {
                final String name = p.getFileName().toString();
                if (GENERATION.matcher(name).matches() && !name.equals(live)) {
                    stale.add(p);
                } else if (name.startsWith(TEMP_FILE_PREFIX) && name.endsWith(TEMP_FILE_SUFFIX)) {
                    strayPointers.add(p);
                }
            });
        } catch (IOException e) {
            log.warn("Unable to list stale index generations in {}", root, e);
            return;
        }

        for (final Path temp : strayPointers) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                log.warn("Unable to delete leftover pointer file {}", temp, e);
            }
        }

        for (final Path genDir : stale) {
            try (Stream<Path> walk = Files.walk(genDir)) {
                final List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
                for (final Path p : paths) {
                    Files.deleteIfExists(p);
                }
            } catch (IOException e) {
                log.warn("Unable to delete stale index generation {}", genDir, e);
            }
        }
    }
}
