package eu.virtualparadox.hybridrag.ingest.lifecycle;

import eu.virtualparadox.hybridrag.ingest.chunker.Chunker;
import eu.virtualparadox.hybridrag.ingest.cleaner.TextCleaner;
import eu.virtualparadox.hybridrag.ingest.dedup.DeduplicationResult;
import eu.virtualparadox.hybridrag.ingest.dedup.SemanticDeduplicator;
import eu.virtualparadox.hybridrag.ingest.extractor.PageTextExtractor;
import eu.virtualparadox.hybridrag.ingest.extractor.ReferenceDocumentSource;
import eu.virtualparadox.hybridrag.ingest.model.RawPage;
import eu.virtualparadox.hybridrag.rag.embed.EmbeddingService;
import eu.virtualparadox.hybridrag.rag.index.CorpusMutationService;
import eu.virtualparadox.hybridrag.rag.index.model.IndexSnapshot;
import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the document part of the index:
 * <ol>
 *     <li>Extract raw pages per document</li>
 *     <li>Clean and chunk every page</li>
 *     <li>Embed the chunks of a document in one batch</li>
 *     <li>Drop near-duplicate chunks within that document</li>
 *     <li>Publish all surviving chunks as a fresh index and persist it</li>
 * </ol>
 * A document that cannot be read is logged and skipped; the others are still indexed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentIngestionService {

    private final ReferenceDocumentSource documentSource;
    private final PageTextExtractor pageTextExtractor;
    private final TextCleaner textCleaner;
    private final Chunker chunker;
    private final EmbeddingService embeddingService;
    private final SemanticDeduplicator deduplicator;
    private final CorpusMutationService corpusMutationService;

    /**
     * Indexes every reference document found under {@code hybridrag.documents}.
     *
     * @return the published snapshot
     */
    public IndexSnapshot buildFromReferenceDocuments() {
        return buildIndex(documentSource.listDocuments());
    }

    /**
     * Replaces the live index with one built from {@code documents}.
     *
     * @param documents document files; the file name becomes the source id
     * @return the published snapshot
     * @throws eu.virtualparadox.hybridrag.exception.EmbeddingProviderException if chunks cannot be embedded
     */
    public IndexSnapshot buildIndex(final List<Path> documents) {
        final List<RetrievalUnit> allUnits = new ArrayList<>();
        final List<float[]> allEmbeddings = new ArrayList<>();

        for (final Path document : documents) {
            final List<RawPage> pages;
            try {
                pages = pageTextExtractor.extractPages(document.getFileName().toString(), document);
            } catch (UncheckedIOException e) {
                log.error("Skipping unreadable document {}", document, e);
                continue;
            }

            final DeduplicationResult result = ingestPages(pages);
            allUnits.addAll(result.units());
            allEmbeddings.addAll(result.embeddings());
        }

        log.info("Ingested {} documents into {} chunks", documents.size(), allUnits.size());
        return corpusMutationService.initialize(allEmbeddings, allUnits);
    }

    /**
     * Cleans, chunks, embeds and deduplicates the pages of one document.
     *
     * @param pages pages of a single document
     * @return surviving chunks with their embeddings
     */
    public DeduplicationResult ingestPages(final List<RawPage> pages) {
        final List<RetrievalUnit> units = new ArrayList<>();
        for (final RawPage page : pages) {
            final String cleaned = textCleaner.cleanText(page.text());
            units.addAll(chunker.chunkPage(page.sourceId(), page.pageNumber(), cleaned));
        }
        if (units.isEmpty()) {
            return new DeduplicationResult(List.of(), List.of(), 0);
        }

        final List<float[]> embeddings = embeddingService.embed(units.stream().map(RetrievalUnit::text).toList());
        final DeduplicationResult result = deduplicator.deduplicate(units, embeddings);
        log.info("Document {}: {} pages, {} chunks, {} after dedup",
                pages.get(0).sourceId(), pages.size(), units.size(), result.units().size());
        return result;
    }
}
