package eu.virtualparadox.hybridrag.application.bootstrap;

import eu.virtualparadox.hybridrag.application.config.RetrievalProperties;
import eu.virtualparadox.hybridrag.curated.service.CuratedRecordIntegrationService;
import eu.virtualparadox.hybridrag.exception.PersistedIndexNotFoundException;
import eu.virtualparadox.hybridrag.ingest.extractor.ReferenceDocumentSource;
import eu.virtualparadox.hybridrag.ingest.lifecycle.DocumentIngestionService;
import eu.virtualparadox.hybridrag.rag.index.VectorIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Brings the index up on startup.
 * <ol>
 *     <li>Load the persisted index</li>
 *     <li>If none exists yet, build one from the reference documents, when there are any</li>
 *     <li>Integrate the approved curated records</li>
 * </ol>
 * A corrupt index is not rebuilt behind the operator's back: the error propagates and startup fails.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "hybridrag.bootstrap", name = "enabled", havingValue = "true", matchIfMissing = true)
public class IndexBootstrapper implements ApplicationRunner {

    private final RetrievalProperties props;
    private final VectorIndexService vectorIndexService;
    private final ReferenceDocumentSource documentSource;
    private final DocumentIngestionService documentIngestionService;
    private final CuratedRecordIntegrationService curatedRecordIntegrationService;

    @Override
    public void run(final ApplicationArguments args) {
        try {
            vectorIndexService.load(props.getIndex());
        } catch (PersistedIndexNotFoundException e) {
            final List<Path> documents = documentSource.listDocuments();
            if (documents.isEmpty()) {
                log.warn("{}; no reference documents under {} either, starting with an empty index",
                        e.getMessage(), props.getDocuments());
            } else {
                log.info("{}; building it from {} reference documents", e.getMessage(), documents.size());
                documentIngestionService.buildIndex(documents);
            }
        }

        curatedRecordIntegrationService.reloadCuratedRecords();
        log.info("Index ready: {} units, state {}", vectorIndexService.size(), vectorIndexService.state());
    }
}
