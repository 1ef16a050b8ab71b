package de.mirkosertic.textmetrics.analysis;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Computes how often keywords occur in a text relative to its word count.
 *
 * <p>Occurrences are literal, case-insensitive, non-overlapping substring matches, so a keyword
 * embedded in a longer word counts as well. Because of that the density of short keywords may
 * exceed what the word count suggests; it is not capped.</p>
 */
public class KeywordDensityScorer {

    private final TextTokenizer tokenizer;

    public KeywordDensityScorer() {
        this(TextTokenizer.basic());
    }

    public KeywordDensityScorer(final TextTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public KeywordDensity keywordDensity(final String text, final List<String> keywords) {
        return keywordDensity(text, keywords, new Diagnostics());
    }

    /**
     * @param text        the document text
     * @param keywords    keywords to look for; duplicates are allowed, the mapping keeps one entry per keyword
     * @param diagnostics receives tokenizer fallbacks
     * @return density in percent per keyword; 0.0 for blank keywords and for every keyword of a document without words
     */
    public KeywordDensity keywordDensity(final String text, final List<String> keywords, final Diagnostics diagnostics) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(keywords, "keywords");

        final Tokenization tokenization = tokenizer.tokenize(text);
        diagnostics.addAll(tokenization.diagnostics());
        final int tokenCount = tokenization.size();
        final String lowerCasedText = text.toLowerCase(Locale.ROOT);

        final Map<String, Double> densities = new LinkedHashMap<>();
        for (final String keyword : keywords) {
            Objects.requireNonNull(keyword, "keyword");
            if (tokenCount == 0 || keyword.isBlank()) {
                densities.put(keyword, 0.0);
                continue;
            }
            final int occurrences = countOccurrences(lowerCasedText, keyword.toLowerCase(Locale.ROOT));
            densities.put(keyword, occurrences * 100.0 / tokenCount);
        }
        return new KeywordDensity(densities, tokenCount);
    }

    static int countOccurrences(final String text, final String keyword) {
        if (keyword.isEmpty()) {
            return 0;
        }
        int count = 0;
        int from = 0;
        int found;
        while ((found = text.indexOf(keyword, from)) >= 0) {
            count++;
            from = found + keyword.length();
        }
        return count;
    }
}
