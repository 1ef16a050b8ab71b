package de.mirkosertic.textmetrics.analysis;

import java.util.List;
import java.util.Objects;

/**
 * Options of a batch analysis.
 *
 * @param language          language of the documents, code or name
 * @param keywords          keywords for the density analysis, may be empty
 * @param topN              size of frequency and salience tables
 * @param perDocumentScores whether per-document TF-IDF/WDF-IDF tables are computed as well
 */
public record AnalysisOptions(String language, List<String> keywords, int topN, boolean perDocumentScores) {

    public static final String DEFAULT_LANGUAGE = "german";

    public AnalysisOptions {
        Objects.requireNonNull(language, "language");
        keywords = List.copyOf(keywords);
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be positive, was " + topN);
        }
    }

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(DEFAULT_LANGUAGE, List.of(), FrequencyCounter.DEFAULT_TOP_N, false);
    }

    public AnalysisOptions withLanguage(final String newLanguage) {
        return new AnalysisOptions(newLanguage, keywords, topN, perDocumentScores);
    }

    public AnalysisOptions withKeywords(final List<String> newKeywords) {
        return new AnalysisOptions(language, newKeywords, topN, perDocumentScores);
    }

    public AnalysisOptions withTopN(final int newTopN) {
        return new AnalysisOptions(language, keywords, newTopN, perDocumentScores);
    }

    public AnalysisOptions withPerDocumentScores(final boolean enabled) {
        return new AnalysisOptions(language, keywords, topN, enabled);
    }
}
