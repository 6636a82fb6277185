package eu.virtualparadox.hybridrag.ingest.extractor;

import eu.virtualparadox.hybridrag.ingest.model.RawPage;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Extracts from a small PDF generated on the fly: text on pages 1 and 3, page 2 blank.
 */
class PdfPageTextExtractorTest {

    @TempDir
    Path dir;

    private final PdfPageTextExtractor extractor = new PdfPageTextExtractor();

    private Path writePdf(String... pageTexts) throws IOException {
        Path file = dir.resolve("sample.pdf");
        try (PDDocument doc = new PDDocument()) {
            for (String text : pageTexts) {
                PDPage page = new PDPage();
                doc.addPage(page);
                if (text.isEmpty()) {
                    continue;
                }
                try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                    cs.beginText();
                    cs.setFont(PDType1Font.HELVETICA, 12);
                    cs.newLineAtOffset(72, 700);
                    cs.showText(text);
                    cs.endText();
                }
            }
            doc.save(file.toFile());
        }
        return file;
    }

    @Test
    @DisplayName("One raw page per non-blank page, with 1-based page numbers")
    void extractsPages() throws IOException {
        Path pdf = writePdf("The fee is due on application.", "", "Interviews take place in Tokyo.");

        List<RawPage> pages = extractor.extractPages("sample.pdf", pdf);

        assertThat(pages).extracting(RawPage::pageNumber).containsExactly(1, 3);
        assertThat(pages).extracting(RawPage::sourceId).containsOnly("sample.pdf");
        assertThat(pages.get(0).text()).contains("The fee is due on application.");
        assertThat(pages.get(1).text()).contains("Interviews take place in Tokyo.");
    }

    @Test
    @DisplayName("Missing file surfaces as UncheckedIOException")
    void missingFile() {
        assertThrows(UncheckedIOException.class, () -> extractor.extractPages("x.pdf", dir.resolve("missing.pdf")));
    }
}
