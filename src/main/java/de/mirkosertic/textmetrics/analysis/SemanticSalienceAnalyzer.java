package de.mirkosertic.textmetrics.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds the most frequent tokens of a text after removing the stopwords of its language.
 */
public class SemanticSalienceAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(SemanticSalienceAnalyzer.class);

    static final String COMPONENT = "salience";

    private final TextTokenizer tokenizer;
    private final StopwordProvider stopwordProvider;
    private final int topN;

    public SemanticSalienceAnalyzer(final TextTokenizer tokenizer, final StopwordProvider stopwordProvider) {
        this(tokenizer, stopwordProvider, FrequencyCounter.DEFAULT_TOP_N);
    }

    public SemanticSalienceAnalyzer(final TextTokenizer tokenizer, final StopwordProvider stopwordProvider, final int topN) {
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be positive, was " + topN);
        }
        this.tokenizer = tokenizer;
        this.stopwordProvider = stopwordProvider;
        this.topN = topN;
    }

    public SalienceResult semanticSalience(final String text, final String language) {
        return semanticSalience(text, language, new Diagnostics());
    }

    /**
     * @param text        the document text
     * @param language    language of the text, selects tokenizer model and stopwords
     * @param diagnostics receives tokenizer and stopword fallbacks and failures
     * @return distinct meaningful token count and the top tokens; empty on failure
     */
    public SalienceResult semanticSalience(final String text, final String language, final Diagnostics diagnostics) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(language, "language");
        try {
            final Tokenization tokenization = tokenizer.tokenize(text, language);
            diagnostics.addAll(tokenization.diagnostics());

            final StopwordSet stopwords = stopwordProvider.stopwords(language);
            if (stopwords.fallback()) {
                diagnostics.add(COMPONENT, "No stopword list for '" + stopwords.language()
                        + "', using the built-in fallback list");
            }

            final List<String> meaningful = new ArrayList<>(tokenization.size());
            for (final String token : tokenization.tokens()) {
                if (!stopwords.contains(token)) {
                    meaningful.add(token);
                }
            }
            final WordStats stats = FrequencyCounter.statsOf(meaningful, topN);
            return new SalienceResult(stats.uniqueWords(), stats.topFrequency());
        } catch (final RuntimeException e) {
            logger.warn("Semantic salience analysis failed for language '{}'", language, e);
            diagnostics.add(COMPONENT, "Semantic salience analysis failed: " + e.getMessage());
            return SalienceResult.empty();
        }
    }
}
