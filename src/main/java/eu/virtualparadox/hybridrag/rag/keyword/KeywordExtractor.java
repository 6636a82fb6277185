package eu.virtualparadox.hybridrag.rag.keyword;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives match keywords from a query written in mixed Japanese and Latin script.
 * <p>
 * Japanese text has no word separators, so every run of kana, kanji or CJK punctuation
 * contributes the run itself plus all of its 2- and 3-character substrings. Latin text
 * contributes whitespace tokens and alphanumeric codes such as {@code E-2} or {@code L-1}.
 * Keywords are lower-cased, at least two characters long and unique, in first-seen order.
 */
@Component
public class KeywordExtractor {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u3000]+");
    private static final Pattern ALPHANUMERIC = Pattern.compile("[A-Za-z0-9\\-]+");
    private static final Pattern CJK_RUN =
            Pattern.compile("[\\u3000-\\u303f\\u3040-\\u309f\\u30a0-\\u30ff\\u4e00-\\u9faf]+");

    private static final int MIN_KEYWORD_LENGTH = 2;

    /**
     * @param query raw query text, may be {@code null}
     * @return keywords in first-seen order, empty when nothing qualifies
     */
    public List<String> extract(final String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }

        final List<String> raw = new ArrayList<>();
        for (final String token : WHITESPACE.split(query.trim())) {
            if (token.length() > 1) {
                raw.add(token);
            }
        }

        final Matcher alnum = ALPHANUMERIC.matcher(query);
        while (alnum.find()) {
            if (alnum.group().length() > 1) {
                raw.add(alnum.group());
            }
        }

        final Matcher cjk = CJK_RUN.matcher(query);
        while (cjk.find()) {
            final String run = cjk.group();
            if (run.length() < 2) {
                continue;
            }
            raw.add(run);
            for (int i = 0; i + 2 <= run.length(); i++) {
                raw.add(run.substring(i, i + 2));
                if (i + 3 <= run.length()) {
                    raw.add(run.substring(i, i + 3));
                }
            }
        }

        final Set<String> keywords = new LinkedHashSet<>();
        for (final String kw : raw) {
            if (kw.length() >= MIN_KEYWORD_LENGTH) {
                keywords.add(kw.toLowerCase(Locale.ROOT));
            }
        }
        return List.copyOf(keywords);
    }
}
