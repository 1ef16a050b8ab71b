package de.mirkosertic.textmetrics.analysis;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Counts words of a document.
 *
 * <p>Uses the basic (regex, then whitespace) tokenizer: counting only needs consistent word
 * boundaries, not linguistic correctness.</p>
 */
public class FrequencyCounter {

    public static final int DEFAULT_TOP_N = 10;

    private final TextTokenizer tokenizer;
    private final int defaultTopN;

    public FrequencyCounter() {
        this(TextTokenizer.basic(), DEFAULT_TOP_N);
    }

    public FrequencyCounter(final TextTokenizer tokenizer, final int defaultTopN) {
        if (defaultTopN < 1) {
            throw new IllegalArgumentException("defaultTopN must be positive, was " + defaultTopN);
        }
        this.tokenizer = tokenizer;
        this.defaultTopN = defaultTopN;
    }

    public WordStats wordStats(final String text) {
        return wordStats(text, defaultTopN);
    }

    public WordStats wordStats(final String text, final int topN) {
        return wordStats(text, topN, new Diagnostics());
    }

    /**
     * @param text        the document text
     * @param topN        number of entries kept in the frequency table
     * @param diagnostics receives tokenizer fallbacks
     */
    public WordStats wordStats(final String text, final int topN, final Diagnostics diagnostics) {
        Objects.requireNonNull(text, "text");
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be positive, was " + topN);
        }
        final Tokenization tokenization = tokenizer.tokenize(text);
        diagnostics.addAll(tokenization.diagnostics());
        if (tokenization.tokens().isEmpty()) {
            return WordStats.empty();
        }
        return statsOf(tokenization.tokens(), topN);
    }

    /**
     * Counts tokens and keeps the {@code topN} most frequent, ties in first-appearance order.
     */
    public static FrequencyTable topTerms(final List<String> tokens, final int topN) {
        return FrequencyTable.of(tokens, topN);
    }

    /**
     * Computes statistics of an already tokenized document.
     */
    public static WordStats statsOf(final List<String> tokens, final int topN) {
        final Map<String, Integer> counts = FrequencyTable.countInOrder(tokens);
        return new WordStats(tokens.size(), counts.size(), FrequencyTable.fromCounts(counts, topN));
    }
}
