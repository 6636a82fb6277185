package eu.virtualparadox.hybridrag.ingest.chunker;

import eu.virtualparadox.hybridrag.exception.InvalidConfigurationException;
import eu.virtualparadox.hybridrag.rag.index.model.RetrievalUnit;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sentence-aware {@code Chunker} that turns one cleaned page into overlapping retrieval units.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Sentence splitting:</strong> a segment ends right after one of the terminators
 *       {@code 。！？.!?}; the terminator stays attached to its segment. Trailing text without a
 *       terminator forms a final segment. Segments are trimmed and those shorter than
 *       {@code minSegmentLength} characters are dropped as noise.</li>
 *   <li><strong>Packing:</strong> segments are appended to a running buffer, joined by a single
 *       space. When appending the next segment would make the buffer longer than
 *       {@code chunkSize}, the buffer is emitted first.</li>
 *   <li><strong>Overlap:</strong> the buffer following an emission is seeded with the last
 *       {@code overlap} characters of the emitted text (all of it when shorter), a space and the
 *       segment that triggered the emission. Units are emitted untrimmed, so the seed is always
 *       a verbatim prefix of the next unit.</li>
 * </ul>
 *
 * <h2>Size bound</h2>
 * Every unit except the last of a page is at most {@code chunkSize} plus the length of the single
 * segment that caused the previous emission.
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * Stateless after construction. The same {@code (text, chunkSize, overlap)} always yields the
 * same sequence of units, which keeps rebuilds reproducible.
 */
@Component
public class Chunker {

    /**
     * A segment ends after a CJK or Latin sentence terminator. The look-behind keeps the
     * terminator on the left-hand segment.
     */
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[。！？.!?])");

    private final int chunkSize;
    private final int overlap;
    private final int minSegmentLength;

    /**
     * @param chunkSize        soft upper bound on unit length in characters (must be {@code > 0})
     * @param overlap          trailing characters carried into the next unit ({@code 0 <= overlap < chunkSize})
     * @param minSegmentLength segments shorter than this are discarded ({@code >= 0})
     * @throws InvalidConfigurationException if constraints are violated
     */
    public Chunker(@Value("${hybridrag.chunk-size:800}") final int chunkSize,
                   @Value("${hybridrag.chunk-overlap:100}") final int overlap,
                   @Value("${hybridrag.min-segment-length:10}") final int minSegmentLength) {
        if (chunkSize <= 0) {
            throw new InvalidConfigurationException("chunkSize must be positive");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new InvalidConfigurationException("overlap must be non-negative and less than chunkSize");
        }
        if (minSegmentLength < 0) {
            throw new InvalidConfigurationException("minSegmentLength must not be negative");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
        this.minSegmentLength = minSegmentLength;
    }

    /**
     * Chunks one cleaned page into document-chunk units.
     *
     * @param sourceId   originating document (non-blank)
     * @param pageNumber 1-based page number
     * @param text       cleaned page text (non-null, may be blank)
     * @return ordered units of this page; empty when no segment survives the noise filter
     */
    public List<RetrievalUnit> chunkPage(final String sourceId, final int pageNumber, final String text) {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId cannot be null or blank");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }

        final List<RetrievalUnit> units = new ArrayList<>();
        for (final String chunkText : chunkText(text)) {
            units.add(RetrievalUnit.documentChunk(chunkText, sourceId, pageNumber));
        }
        return units;
    }

    /**
     * Text-only variant of {@link #chunkPage(String, int, String)}.
     *
     * @param text cleaned page text
     * @return ordered chunk texts
     */
    public List<String> chunkText(final String text) {
        final List<String> chunks = new ArrayList<>();
        final StringBuilder buffer = new StringBuilder();

        for (final String segment : splitSegments(text)) {
            if (buffer.length() > 0 && buffer.length() + 1 + segment.length() > chunkSize) {
                final String emitted = buffer.toString();
                chunks.add(emitted);

                buffer.setLength(0);
                final String seed = tail(emitted, overlap);
                if (!seed.isEmpty()) {
                    buffer.append(seed).append(' ');
                }
                buffer.append(segment);
            } else {
                if (buffer.length() > 0) {
                    buffer.append(' ');
                }
                buffer.append(segment);
            }
        }

        if (buffer.length() > 0) {
            chunks.add(buffer.toString());
        }
        return chunks;
    }

    /**
     * Splits text into trimmed sentence segments and drops the ones below the noise threshold.
     *
     * @param text source text
     * @return segments in document order
     */
    List<String> splitSegments(final String text) {
        final List<String> segments = new ArrayList<>();
        for (final SentenceSpan span : sentenceSpans(text)) {
            final String segment = text.substring(span.start(), span.end()).trim();
            if (!segment.isEmpty() && segment.length() >= minSegmentLength) {
                segments.add(segment);
            }
        }
        return segments;
    }

    private static List<SentenceSpan> sentenceSpans(final String text) {
        final List<SentenceSpan> spans = new ArrayList<>();
        final Matcher matcher = SENTENCE_END.matcher(text);

        int lastEnd = 0;
        while (matcher.find()) {
            final int boundary = matcher.start();
            if (boundary > lastEnd) {
                spans.add(new SentenceSpan(lastEnd, boundary));
            }
            lastEnd = boundary;
        }
        if (lastEnd < text.length()) {
            spans.add(new SentenceSpan(lastEnd, text.length()));
        }
        return spans;
    }

    /**
     * @return the final {@code n} characters of {@code s}, or {@code s} itself when shorter
     */
    private static String tail(final String s, final int n) {
        if (n <= 0) {
            return "";
        }
        return s.length() <= n ? s : s.substring(s.length() - n);
    }
}
