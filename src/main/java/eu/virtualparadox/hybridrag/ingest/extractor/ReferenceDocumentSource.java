package eu.virtualparadox.hybridrag.ingest.extractor;

import eu.virtualparadox.hybridrag.application.config.RetrievalProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Lists the reference PDFs under {@code hybridrag.documents}, sorted by file name so that
 * builds see documents in a stable order.
 */
@Component
@RequiredArgsConstructor
public class ReferenceDocumentSource {

    private static final String PDF_SUFFIX = ".pdf";

    private final RetrievalProperties props;

    public List<Path> listDocuments() {
        final Path dir = props.getDocuments();
        if (dir == null || !Files.isDirectory(dir)) {
            return List.of();
        }

        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(PDF_SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list reference documents in " + dir, e);
        }
    }
}
