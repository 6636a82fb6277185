package eu.virtualparadox.hybridrag.ingest.cleaner;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Normalises extracted page text before chunking.
 * <p>
 * Steps, in order:
 * <ol>
 *   <li>Drop lines that consist of nothing but a page number (running headers/footers).</li>
 *   <li>Zero-width characters, non-breaking spaces and other format characters become spaces.</li>
 *   <li>Soft hyphens and control characters are removed.</li>
 *   <li>All whitespace runs, line breaks included, collapse to a single space; the result is trimmed.</li>
 * </ol>
 * Page-number lines are removed before the line structure is flattened, otherwise
 * they could no longer be told apart from numbers inside sentences.
 */
@Component
public class TextCleaner {

    private static final Pattern PAGE_NUMBER_LINE = Pattern.compile("(?m)^[ \\t\\u3000]*\\d+[ \\t\\u3000]*$");
    private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B\\u200C\\u200D\\uFEFF]");
    private static final Pattern FORMAT_CHARS = Pattern.compile("\\p{Cf}");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cc}&&[^\\s]]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("[\\s\\u3000]+");

    /**
     * Cleans a single page of extracted text.
     *
     * @param input raw page text, may be {@code null}
     * @return cleaned text, never {@code null}
     */
    public String cleanText(final String input) {
        if (StringUtils.isEmpty(input)) {
            return "";
        }

        String text = PAGE_NUMBER_LINE.matcher(input.replace("\r\n", "\n").replace('\r', '\n')).replaceAll("");
        text = ZERO_WIDTH.matcher(text).replaceAll(" ");
        text = text.replace('\u00A0', ' ');
        text = text.replace("\u00AD", "");
        text = FORMAT_CHARS.matcher(text).replaceAll(" ");
        text = CONTROL_CHARS.matcher(text).replaceAll("");
        return WHITESPACE_RUN.matcher(text).replaceAll(" ").trim();
    }
}
