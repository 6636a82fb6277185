package eu.virtualparadox.hybridrag.ingest.extractor;

import eu.virtualparadox.hybridrag.ingest.model.RawPage;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF extractor backed by Apache PDFBox.
 * <p>Pages are stripped one at a time so every {@link RawPage} carries its 1-based page number.
 * Text is NFC-normalised; pages without any text (scans, blank pages) are skipped.</p>
 */
@Slf4j
@Service
public final class PdfPageTextExtractor implements PageTextExtractor {

    @Override
    public List<RawPage> extractPages(final String sourceId, final Path path) {
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();

            final List<RawPage> pages = new ArrayList<>(pageCount);
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);

                final String pageText = Normalizer.normalize(stripper.getText(pdf), Normalizer.Form.NFC);
                if (!pageText.isBlank()) {
                    pages.add(new RawPage(sourceId, page, pageText));
                }
            }

            log.info("Extracted {} of {} pages from {}", pages.size(), pageCount, path.getFileName());
            return pages;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to extract text from PDF " + path, e);
        }
    }
}
