package eu.virtualparadox.hybridrag.ingest.extractor;

import eu.virtualparadox.hybridrag.ingest.model.RawPage;

import java.nio.file.Path;
import java.util.List;

public interface PageTextExtractor {

    /**
     * @param sourceId identifier recorded on every page
     * @param path     document file
     * @return raw page texts in page order
     */
    List<RawPage> extractPages(final String sourceId, final Path path);

}
