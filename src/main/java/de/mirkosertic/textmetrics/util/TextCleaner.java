package de.mirkosertic.textmetrics.util;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans extracted document text while keeping its paragraph structure.
 */
public final class TextCleaner {

    /**
     * Characters dropped entirely:
     * <ul>
     *   <li>U+0000-U+0008, U+000B-U+000C, U+000E-U+001F, U+007F-U+009F: control characters except tab, LF and CR</li>
     *   <li>U+200B-U+200D: zero-width space, non-joiner and joiner</li>
     *   <li>U+FEFF: byte order mark</li>
     *   <li>U+FFFD: replacement character of failed decoding</li>
     * </ul>
     */
    private static final Pattern INVALID_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F-\\x9F\\u200B-\\u200D\\uFEFF\\uFFFD]");

    /**
     * Non-breaking, ideographic and typographic spaces, replaced by a regular space.
     */
    private static final Pattern UNICODE_SPACES = Pattern.compile("[\\u00A0\\u1680\\u2000-\\u200A\\u202F\\u205F\\u3000]");

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[\\t ]+");
    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?|\\n");

    private TextCleaner() {
    }

    /**
     * Splits text into paragraphs: one per line, cleaned, trimmed, blank lines dropped.
     *
     * @param text raw text, e.g. as extracted by Tika
     * @return the non-blank paragraphs in document order
     */
    public static List<String> paragraphs(final String text) {
        final List<String> paragraphs = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return paragraphs;
        }
        for (final String line : LINE_BREAKS.split(normalize(text))) {
            final String paragraph = HORIZONTAL_WHITESPACE.matcher(line).replaceAll(" ").trim();
            if (!paragraph.isEmpty()) {
                paragraphs.add(paragraph);
            }
        }
        return paragraphs;
    }

    /**
     * NFKC normalization (ligatures, full-width forms), invalid character removal and
     * space unification.
     */
    static String normalize(final String text) {
        String result = Normalizer.normalize(text, Normalizer.Form.NFKC);
        result = INVALID_CHARS.matcher(result).replaceAll("");
        return UNICODE_SPACES.matcher(result).replaceAll(" ");
    }
}
