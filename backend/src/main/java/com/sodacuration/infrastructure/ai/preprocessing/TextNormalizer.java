package com.sodacuration.infrastructure.ai.preprocessing;

import org.jsoup.Jsoup;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes text for verbatim comparison. Fixed order:
 * - strip markup tags
 * - decode entities
 * - lowercase
 * - Unicode canonical decomposition, combining marks removed
 * - drop everything that is neither alphanumeric nor whitespace
 * - collapse whitespace runs, trim
 */
@Component
public class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile(
            "[^\\p{L}\\p{N}\\s]", Pattern.UNICODE_CHARACTER_CLASS
    );

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * @param text raw text, possibly HTML
     * @return normalized text; empty for null or blank input
     */
    public String normalizeForComparison(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }

        // 1. Strip markup (Jsoup also decodes entities inside the markup)
        String result = Jsoup.parse(text).wholeText();

        // 2. Decode entities left after markup stripping (double-encoded input)
        result = Parser.unescapeEntities(result, false);

        // 3. Lowercase
        result = result.toLowerCase(Locale.ROOT);

        // 4. Canonical decomposition, then drop combining marks
        result = Normalizer.normalize(result, Normalizer.Form.NFD);
        result = COMBINING_MARKS.matcher(result).replaceAll("");

        // 5. Keep only letters, digits and whitespace
        result = NON_ALPHANUMERIC.matcher(result).replaceAll("");

        // 6. Collapse whitespace
        result = WHITESPACE_RUN.matcher(result).replaceAll(" ");

        // 7. Trim
        return result.strip();
    }
}
