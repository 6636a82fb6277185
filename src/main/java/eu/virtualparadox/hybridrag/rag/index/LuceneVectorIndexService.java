package eu.virtualparadox.hybridrag.rag.index;

import eu.virtualparadox.hybridrag.rag.index.model.IndexSnapshot;
import eu.virtualparadox.hybridrag.rag.index.model.IndexState;
import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;
import eu.virtualparadox.hybridrag.rag.index.model.VectorHit;
import eu.virtualparadox.hybridrag.rag.index.store.LuceneIndexStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link VectorIndexService} keeping the live {@link IndexSnapshot} in memory and persisting
 * it through {@link LuceneIndexStore}.
 * <p>
 * The snapshot sits behind an {@link AtomicReference}: searches read it without locking,
 * writers serialise on {@code writeLock}, build the successor and swap it in.
 * The state flag is only changed while holding the lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public final class LuceneVectorIndexService implements VectorIndexService {

    private final LuceneIndexStore store;

    private final AtomicReference<IndexSnapshot> current = new AtomicReference<>(IndexSnapshot.empty());
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile IndexState state = IndexState.EMPTY;

    @Override
    public IndexSnapshot create(final List<float[]> embeddings, final List<RetrievalUnit> units) {
        writeLock.lock();
        try {
            final IndexSnapshot next = IndexSnapshot.create(embeddings, units, nextVersion());
            current.set(next);
            state = IndexState.DIRTY;
            log.info("Created index with {} units (dim={}, version={})", next.size(), next.dimension(), next.version());
            return next;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public IndexSnapshot replace(final List<float[]> embeddings, final List<RetrievalUnit> units) {
        writeLock.lock();
        try {
            final IndexSnapshot previous = current.get();
            final IndexSnapshot next = IndexSnapshot.create(embeddings, units, nextVersion());
            current.set(next);
            state = IndexState.DIRTY;
            log.info("Replaced index version {} ({} units) with version {} ({} units)",
                    previous.version(), previous.size(), next.version(), next.size());
            return next;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<VectorHit> search(final float[] queryEmbedding, final int k) {
        return current.get().search(queryEmbedding, k);
    }

    @Override
    public RetrievalUnit append(final float[] embedding, final RetrievalUnit unit) {
        writeLock.lock();
        try {
            final IndexSnapshot next = current.get().appended(embedding, unit, nextVersion());
            current.set(next);
            state = IndexState.DIRTY;

            final RetrievalUnit stored = next.units().get(next.size() - 1);
            log.debug("Appended unit {} from {} (index size {})", stored.id(), stored.sourceId(), next.size());
            return stored;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void save(final Path path) {
        writeLock.lock();
        try {
            store.write(path, current.get());
            state = IndexState.PERSISTED;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public IndexSnapshot load(final Path path) {
        writeLock.lock();
        try {
            final IndexSnapshot loaded = store.read(path, nextVersion());
            current.set(loaded);
            state = IndexState.LOADED;
            return loaded;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public IndexSnapshot snapshot() {
        return current.get();
    }

    @Override
    public IndexState state() {
        return state;
    }

    private long nextVersion() {
        return current.get().version() + 1;
    }
}
