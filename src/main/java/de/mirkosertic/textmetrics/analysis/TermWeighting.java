package de.mirkosertic.textmetrics.analysis;

/**
 * Within-document weight combined with the inverse document frequency by {@link CorpusScorer}.
 */
public enum TermWeighting {

    /**
     * Relative term frequency: {@code count / documentLength}.
     */
    TF_IDF {
        @Override
        double weight(final int count, final int documentLength) {
            return (double) count / documentLength;
        }
    },

    /**
     * Logarithmically damped raw count: {@code ln(1 + count)}, 0 for absent terms.
     */
    WDF_IDF {
        @Override
        double weight(final int count, final int documentLength) {
            return count > 0 ? Math.log(1 + count) : 0.0;
        }
    };

    abstract double weight(int count, int documentLength);

    /**
     * Smoothed inverse document frequency {@code ln(N / (df + 1))}.
     * Negative for terms present in every document, never NaN or infinite for {@code 1 <= df <= N}.
     */
    static double inverseDocumentFrequency(final int documentCount, final int documentFrequency) {
        return Math.log((double) documentCount / (documentFrequency + 1));
    }
}
